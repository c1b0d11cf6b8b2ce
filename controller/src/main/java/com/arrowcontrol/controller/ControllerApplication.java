package com.arrowcontrol.controller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Controller service: accepts target sessions, pairs them and dispatches arrow-key commands.
 */
@SpringBootApplication
@EnableScheduling
public class ControllerApplication {

    public static void main(String[] args) {
        System.out.println("🚀 Starting Arrow Control controller...");
        System.out.println("☕ Java Version: " + System.getProperty("java.version"));
        SpringApplication.run(ControllerApplication.class, args);
    }
}
