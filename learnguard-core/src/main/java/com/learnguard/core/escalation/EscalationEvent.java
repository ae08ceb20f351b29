package com.learnguard.core.escalation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.learnguard.common.model.SafetyLevel;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * A request handed to a human supervisor. Immutable; resolving yields a new instance.
 * {@code teacherId} is null when nobody is assigned to the learner.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EscalationEvent {

    String id;
    String userId;
    String sessionId;
    String requestId;
    String courseId;
    String query;
    String reason;
    SafetyLevel severity;
    String ruleId;
    String teacherId;
    boolean resolved;
    String resolvedBy;
    String resolution;
    Instant createdAt;
    Instant resolvedAt;

    public EscalationEvent resolve(String teacher, String resolutionText, Instant at) {
        return toBuilder()
            .resolved(true)
            .resolvedBy(teacher)
            .resolution(resolutionText)
            .resolvedAt(at)
            .build();
    }

    @JsonIgnore
    public boolean isAssigned() {
        return teacherId != null;
    }

    public Duration timeToResolve() {
        return resolved && resolvedAt != null ? Duration.between(createdAt, resolvedAt) : null;
    }
}
