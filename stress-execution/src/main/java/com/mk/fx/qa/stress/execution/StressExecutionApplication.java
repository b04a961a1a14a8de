package com.mk.fx.qa.stress.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StressExecutionApplication {

  public static void main(String[] args) {
    SpringApplication.run(StressExecutionApplication.class, args);
  }
}
