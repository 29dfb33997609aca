package com.stepwright.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StepwrightApplication {

    public static void main(String[] args) {
        SpringApplication.run(StepwrightApplication.class, args);
    }
}
