package com.mk.fx.qa.task.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskExecutionApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaskExecutionApplication.class, args);
  }
}
