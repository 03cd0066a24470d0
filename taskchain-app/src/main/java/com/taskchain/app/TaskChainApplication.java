package com.taskchain.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application entry point for the task chain worker.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskChainApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskChainApplication.class, args);
    }
}
