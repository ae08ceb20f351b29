package com.learnguard.core.cache;

import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.QueryType;
import com.learnguard.core.config.CacheProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Lifetime of a cached answer: base TTL scaled by question type, answer confidence and
 * learner age, clamped to [5 minutes, 24 hours].
 */
@Component
public class TtlPolicy {

    static final long MIN_TTL_SECONDS = 300;
    static final long MAX_TTL_SECONDS = 86_400;

    private static final Map<QueryType, Double> TYPE_FACTORS = new EnumMap<>(QueryType.class);

    static {
        TYPE_FACTORS.put(QueryType.GENERAL_QUESTION, 2.0);
        TYPE_FACTORS.put(QueryType.HOMEWORK_HELP, 0.5);
        TYPE_FACTORS.put(QueryType.CONCEPT_EXPLANATION, 1.5);
        TYPE_FACTORS.put(QueryType.PROBLEM_SOLVING, 0.3);
    }

    private final Duration baseTtl;

    public TtlPolicy(CacheProperties properties) {
        this.baseTtl = properties.getBaseTtl();
    }

    public Duration ttlFor(LearningRequest request, LearningResponse response) {
        double seconds = baseTtl.toSeconds();
        if (request.getQueryType() != null) {
            seconds *= TYPE_FACTORS.getOrDefault(request.getQueryType(), 1.0);
        }
        if (response.getConfidence() < 0.7) {
            seconds *= 0.5;
        }
        Integer age = request.learnerAge();
        if (age != null && age < 13) {
            seconds *= 0.7;
        }
        long clamped = Math.max(MIN_TTL_SECONDS, Math.min(MAX_TTL_SECONDS, Math.round(seconds)));
        return Duration.ofSeconds(clamped);
    }
}
