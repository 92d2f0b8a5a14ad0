package com.airgate.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * AirGate application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.airgate")
public class AirGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(AirGateApplication.class, args);
    }
}
