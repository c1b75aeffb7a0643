package com.cfoPilot.aiCfo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiCfoApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiCfoApplication.class, args);
    }
}
