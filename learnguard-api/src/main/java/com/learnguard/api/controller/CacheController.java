package com.learnguard.api.controller;

import com.learnguard.core.cache.CacheStats;
import com.learnguard.core.cache.ResponseCache;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
public class CacheController {

    private final ResponseCache responseCache;

    @GetMapping("/stats")
    public ResponseEntity<CacheStats> getStats() {
        return ResponseEntity.ok(responseCache.getStats());
    }

    @DeleteMapping("/users/{userId}")
    public ResponseEntity<Map<String, Long>> invalidateUser(@PathVariable String userId) {
        return ResponseEntity.ok(Map.of("deleted", responseCache.invalidateUser(userId)));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, Long>> invalidateSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(Map.of("deleted", responseCache.invalidateSession(sessionId)));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Long>> clear() {
        return ResponseEntity.ok(Map.of("deleted", responseCache.clear()));
    }
}
