package com.automation.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the workflow automation core.
 */
@SpringBootApplication
public class AutomationApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(AutomationApplication.class, args);
    }
}
