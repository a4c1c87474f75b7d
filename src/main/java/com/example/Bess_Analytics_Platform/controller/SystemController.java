package com.example.Bess_Analytics_Platform.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Service banner and liveness check.
 */
@RestController
public class SystemController {

    private static final String VERSION = "1.0.0";

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> banner = new HashMap<>();
        banner.put("service", "BESS Analytics Platform");
        banner.put("version", VERSION);
        banner.put("status", "running");
        return ResponseEntity.ok(banner);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("version", VERSION);
        health.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(health);
    }
}
