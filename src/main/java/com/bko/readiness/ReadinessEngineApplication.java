package com.bko.readiness;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReadinessEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReadinessEngineApplication.class, args);
    }
}
