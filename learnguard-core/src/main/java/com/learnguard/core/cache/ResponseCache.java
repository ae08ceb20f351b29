package com.learnguard.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Answer cache in front of the providers.
 * <p>
 * Unsafe answers (safety level high or critical, or flagged for escalation) are refused here,
 * whatever the caller checked. A store outage never reaches the caller: reads miss, writes
 * and invalidations do nothing, and a warning is logged.
 */
@Service
@Slf4j
public class ResponseCache {

    static final String HITS_KEY = "cache:stats:hits";
    static final String MISSES_KEY = "cache:stats:misses";

    private final CacheStore store;
    private final CacheKeyGenerator keyGenerator;
    private final TtlPolicy ttlPolicy;
    private final ObjectMapper mapper;

    public ResponseCache(CacheStore store, CacheKeyGenerator keyGenerator, TtlPolicy ttlPolicy) {
        this.store = store;
        this.keyGenerator = keyGenerator;
        this.ttlPolicy = ttlPolicy;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Optional<LearningResponse> get(LearningRequest request) {
        String key = keyGenerator.keyFor(request);
        try {
            Optional<String> payload = store.get(key);
            if (payload.isEmpty()) {
                store.increment(MISSES_KEY);
                log.debug("[CACHE] Miss | requestId={} | key={}", request.getId(), shortKey(key));
                return Optional.empty();
            }
            LearningResponse cached = mapper.readValue(payload.get(), LearningResponse.class);
            store.increment(HITS_KEY);
            log.info("[CACHE] Hit | requestId={} | key={} | provider={}", request.getId(), shortKey(key), cached.getProvider());
            return Optional.of(cached.asCached());
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Store unavailable, treating as miss | requestId={} | error={}", request.getId(), e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("[CACHE] Unreadable entry dropped | key={} | error={}", shortKey(key), e.getOriginalMessage());
            invalidateKey(key);
            return Optional.empty();
        }
    }

    /**
     * @return whether the answer was written
     */
    public boolean put(LearningRequest request, LearningResponse response) {
        if (!response.isCacheable()) {
            log.debug("[CACHE] Refusing unsafe answer | requestId={} | safetyLevel={} | escalationRecommended={}",
                request.getId(), response.getSafetyLevel(), response.isEscalationRecommended());
            return false;
        }
        String key = keyGenerator.keyFor(request);
        Duration ttl = ttlPolicy.ttlFor(request, response);
        try {
            String payload = mapper.writeValueAsString(response.toBuilder().cached(false).build());
            store.set(key, payload, ttl);
            log.debug("[CACHE] Stored | requestId={} | key={} | ttlSeconds={}", request.getId(), shortKey(key), ttl.toSeconds());
            return true;
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Store unavailable, write skipped | requestId={} | error={}", request.getId(), e.getMessage());
            return false;
        } catch (JsonProcessingException e) {
            log.warn("[CACHE] Could not serialize answer | requestId={} | error={}", request.getId(), e.getOriginalMessage());
            return false;
        }
    }

    public long invalidateUser(String userId) {
        long deleted = deleteByPattern(keyGenerator.userPattern(userId));
        log.info("[CACHE] Invalidated user | userId={} | entries={}", userId, deleted);
        return deleted;
    }

    public long invalidateSession(String sessionId) {
        long deleted = deleteByPattern(keyGenerator.sessionPattern(sessionId));
        log.info("[CACHE] Invalidated session | sessionId={} | entries={}", sessionId, deleted);
        return deleted;
    }

    public boolean invalidateKey(String key) {
        try {
            return store.delete(key);
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Store unavailable, delete skipped | key={} | error={}", shortKey(key), e.getMessage());
            return false;
        }
    }

    /** Drops every cached answer and resets the hit/miss counters. */
    public long clear() {
        long deleted = deleteByPattern(keyGenerator.allPattern());
        invalidateKey(HITS_KEY);
        invalidateKey(MISSES_KEY);
        log.info("[CACHE] Cleared | entries={}", deleted);
        return deleted;
    }

    public CacheStats getStats() {
        try {
            long hits = counter(HITS_KEY);
            long misses = counter(MISSES_KEY);
            long total = hits + misses;
            double hitRate = total == 0 ? 0.0 : Math.round(hits * 10_000.0 / total) / 100.0;
            return CacheStats.builder()
                .hits(hits)
                .misses(misses)
                .hitRate(hitRate)
                .totalKeys(store.countKeys(keyGenerator.allPattern()))
                .available(true)
                .build();
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Store unavailable, stats empty | error={}", e.getMessage());
            return CacheStats.builder().available(false).build();
        }
    }

    /**
     * Pre-loads answers, e.g. for common questions of a new course. Unsafe answers are skipped.
     *
     * @return number of entries written
     */
    public int warmUp(List<WarmUpEntry> entries) {
        int written = 0;
        for (WarmUpEntry entry : entries) {
            if (put(entry.getRequest(), entry.getResponse())) {
                written++;
            }
        }
        log.info("[CACHE] Warm-up complete | offered={} | written={}", entries.size(), written);
        return written;
    }

    public String keyFor(LearningRequest request) {
        return keyGenerator.keyFor(request);
    }

    private long deleteByPattern(String pattern) {
        try {
            return store.deleteByPattern(pattern);
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Store unavailable, invalidation skipped | pattern={} | error={}", pattern, e.getMessage());
            return 0;
        }
    }

    private long counter(String key) {
        return store.get(key).map(Long::parseLong).orElse(0L);
    }

    private static String shortKey(String key) {
        return key.length() > 32 ? key.substring(0, 32) + "..." : key;
    }
}
