package com.mk.fx.qa.task.execution.cfg;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "service")
public class ServiceCfg {

  private String name = "task-execution";

  /** Deployment environment name, e.g. {@code development} or {@code production}. */
  private String environment = "development";
}
