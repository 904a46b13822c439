package com.numaansystems.crmedge.controller;

import com.numaansystems.crmedge.resilience.CircuitBreaker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final CircuitBreaker upstreamCircuitBreaker;

    public HealthController(CircuitBreaker upstreamCircuitBreaker) {
        this.upstreamCircuitBreaker = upstreamCircuitBreaker;
    }

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthInfo = new HashMap<>();
        healthInfo.put("status", "UP");
        healthInfo.put("service", "crm-edge-gateway");
        healthInfo.put("version", "0.1.0");
        healthInfo.put("circuitState", upstreamCircuitBreaker.getState().getState().name());
        return ResponseEntity.ok(healthInfo);
    }
}
