package com.mk.fx.qa.task.execution.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi(ServiceCfg serviceCfg) {
    return new OpenAPI()
        .info(
            new Info()
                .title("Task Execution API")
                .description(
                    "API for submitting asynchronous tasks and tracking their lifecycle ("
                        + serviceCfg.getEnvironment()
                        + ")."));
  }
}
