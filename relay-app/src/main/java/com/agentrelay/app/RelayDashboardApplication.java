package com.agentrelay.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Relay dashboard server entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.agentrelay")
public class RelayDashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayDashboardApplication.class, args);
    }
}
