package com.learnguard.core.support;

import com.learnguard.common.model.LearnerProfile;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.QueryType;
import com.learnguard.common.model.ResponseMetadata;
import com.learnguard.common.model.SafetyLevel;

import java.time.Instant;

public final class TestRequests {

    public static final String ANSWER = "Photosynthesis is how plants turn light into chemical energy.";

    private TestRequests() {}

    public static LearningRequest.LearningRequestBuilder request(String query) {
        return LearningRequest.builder()
            .id("req-1")
            .userId("student-1")
            .sessionId("session-1")
            .query(query)
            .queryType(QueryType.CONCEPT_EXPLANATION)
            .timestamp(Instant.parse("2024-05-01T10:00:00Z"));
    }

    public static LearnerProfile learner(int age) {
        return LearnerProfile.builder().userId("student-1").age(age).build();
    }

    public static LearningResponse.LearningResponseBuilder response(String text) {
        return LearningResponse.builder()
            .id("resp-1")
            .requestId("req-1")
            .text(text)
            .provider("openai")
            .model("gpt-3.5-turbo")
            .confidence(0.9)
            .safetyLevel(SafetyLevel.LOW)
            .tokensUsed(42)
            .latencyMs(120)
            .timestamp(Instant.parse("2024-05-01T10:00:01Z"))
            .metadata(ResponseMetadata.empty());
    }
}
