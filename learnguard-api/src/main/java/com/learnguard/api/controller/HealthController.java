package com.learnguard.api.controller;

import com.learnguard.core.coordinator.LearningRequestCoordinator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Health endpoints for load balancers and monitoring.
 *
 * The plain check never touches providers or the cache; the detailed check probes
 * provider credentials and reports cache availability and open escalations.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private static final String SERVICE_NAME = "learnguard";

    private final LearningRequestCoordinator coordinator;

    private final AtomicLong requestCount = new AtomicLong();
    private final Instant startTime = Instant.now();

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        requestCount.incrementAndGet();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", SERVICE_NAME);

        return ResponseEntity.ok(response);
    }

    /**
     * Status is UP, DEGRADED (a provider is failing or the cache is unreachable) or DOWN (no healthy provider).
     */
    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        requestCount.incrementAndGet();

        Map<String, Object> serviceHealth = coordinator.getServiceHealth();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", toStatus((String) serviceHealth.get("status")));
        response.put("timestamp", Instant.now().toString());
        response.put("service", SERVICE_NAME);
        response.put("uptime", getUptime());
        response.put("requestCount", requestCount.get());
        response.put("providers", serviceHealth.get("providers"));
        response.put("cache", serviceHealth.get("cache"));
        response.put("activeEscalations", serviceHealth.get("activeEscalations"));

        return ResponseEntity.ok(response);
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        requestCount.incrementAndGet();
        return ResponseEntity.ok("pong");
    }

    private static String toStatus(String serviceStatus) {
        return switch (serviceStatus) {
            case "healthy" -> "UP";
            case "degraded" -> "DEGRADED";
            default -> "DOWN";
        };
    }

    private String getUptime() {
        long seconds = Instant.now().getEpochSecond() - startTime.getEpochSecond();
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (days > 0) {
            return String.format("%dd %dh %dm %ds", days, hours, minutes, secs);
        } else if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else {
            return String.format("%ds", secs);
        }
    }
}
