package com.learnguard.api.controller;

import com.learnguard.core.coordinator.LearningRequestCoordinator;
import com.learnguard.llm.router.ProviderOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/llm")
@RequiredArgsConstructor
public class LlmStatsController {

    private final ProviderOrchestrator orchestrator;
    private final LearningRequestCoordinator coordinator;

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStatistics() {
        return ResponseEntity.ok(orchestrator.getStatistics());
    }

    @GetMapping("/usage")
    public ResponseEntity<Map<String, Object>> getUsage() {
        return ResponseEntity.ok(coordinator.getUsageStats());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Boolean> providers = orchestrator.getProviderHealth();
        boolean healthy = providers.containsValue(true);

        return ResponseEntity.status(healthy ? 200 : 503).body(Map.of(
            "status", healthy ? "UP" : "DOWN",
            "providers", providers
        ));
    }
}
