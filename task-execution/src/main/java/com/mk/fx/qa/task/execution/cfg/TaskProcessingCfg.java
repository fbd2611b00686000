package com.mk.fx.qa.task.execution.cfg;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Worker pool settings bound from {@code tasks.processing.*}.
 *
 * <pre>{@code
 * tasks:
 *   processing:
 *     worker-count: 5
 *     processing-delay: 2m
 *     queue-capacity: 100
 *     poll-interval: 100ms
 *     shutdown-timeout: 5s
 * }</pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "tasks.processing")
public class TaskProcessingCfg {

  /** Number of worker threads. Values below 1 are clamped to 1 by the pool. */
  private int workerCount = 5;

  /** Simulated work per task. Zero completes tasks as soon as they are picked up. */
  @NotNull private Duration processingDelay = Duration.ofMinutes(2);

  @Positive private int queueCapacity = 100;

  /** How often an idle worker wakes up to check for a stop request. Must be positive. */
  @NotNull
  @DurationMin(millis = 1)
  private Duration pollInterval = Duration.ofMillis(100);

  /** Deadline for in-flight work when the application context closes. */
  @NotNull private Duration shutdownTimeout = Duration.ofSeconds(5);
}
