package com.ripple.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnomalyDetectorClientApplication {
    public static void main(String[] args) {
        SpringApplication.run(AnomalyDetectorClientApplication.class, args);
    }
}
