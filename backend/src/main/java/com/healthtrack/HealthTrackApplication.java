package com.healthtrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HealthTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthTrackApplication.class, args);
    }
}
