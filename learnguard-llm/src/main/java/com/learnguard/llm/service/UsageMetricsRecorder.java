package com.learnguard.llm.service;

import com.learnguard.common.model.LearningResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Observability hook for generated responses. Failures here never affect a request.
 */
@Component
@Slf4j
public class UsageMetricsRecorder {

    private final Map<String, ProviderUsage> usageByProvider = new ConcurrentHashMap<>();

    public void record(LearningResponse response) {
        try {
            log.info("[USAGE] provider={} | model={} | tokens={} | latencyMs={} | safetyLevel={} | cached={}",
                response.getProvider(), response.getModel(), response.getTokensUsed(),
                response.getLatencyMs(), response.getSafetyLevel(), response.isCached());

            ProviderUsage usage = usageByProvider.computeIfAbsent(response.getProvider(), p -> new ProviderUsage());
            usage.requests.increment();
            usage.tokens.add(response.getTokensUsed());
            usage.latencyMs.add(response.getLatencyMs());
            if (response.isCached()) {
                usage.cacheHits.increment();
            }
        } catch (RuntimeException e) {
            log.warn("[USAGE] Failed to record usage | error={}", e.getMessage());
        }
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new TreeMap<>();
        usageByProvider.forEach((provider, usage) -> {
            long requests = usage.requests.sum();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("requests", requests);
            entry.put("totalTokens", usage.tokens.sum());
            entry.put("averageLatencyMs", requests == 0 ? 0 : usage.latencyMs.sum() / requests);
            entry.put("cacheHits", usage.cacheHits.sum());
            stats.put(provider, entry);
        });
        return stats;
    }

    public long totalRequests() {
        return usageByProvider.values().stream().mapToLong(u -> u.requests.sum()).sum();
    }

    private static class ProviderUsage {
        private final LongAdder requests = new LongAdder();
        private final LongAdder tokens = new LongAdder();
        private final LongAdder latencyMs = new LongAdder();
        private final LongAdder cacheHits = new LongAdder();
    }
}
