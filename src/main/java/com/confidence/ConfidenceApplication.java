package com.confidence;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConfidenceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConfidenceApplication.class, args);
    }
}
