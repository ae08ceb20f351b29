package com.learnguard.core.escalation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class EscalationMetrics {

    Instant from;
    Instant to;
    long totalEscalations;
    long activeEscalations;
    long resolvedEscalations;
    Map<String, Long> byReason;
    Map<String, Long> bySeverity;
    /** Percentage of escalations in the window that are resolved. */
    double resolutionRate;
    double averageResolutionMinutes;
}
