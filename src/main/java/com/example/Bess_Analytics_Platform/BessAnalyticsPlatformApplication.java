package com.example.Bess_Analytics_Platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BessAnalyticsPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(BessAnalyticsPlatformApplication.class, args);
    }
}
