package com.arrowcontrol.target;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Target agent: connects to a controller, pairs, and turns arrow commands into local key presses.
 */
@SpringBootApplication
public class TargetApplication {

    public static void main(String[] args) {
        System.out.println("🚀 Starting Arrow Control target...");
        System.out.println("☕ Java Version: " + System.getProperty("java.version"));
        SpringApplication application = new SpringApplication(TargetApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        // Spring Boot forces headless mode by default, which disables java.awt.Robot.
        application.setHeadless(false);
        application.run(args);
    }
}
