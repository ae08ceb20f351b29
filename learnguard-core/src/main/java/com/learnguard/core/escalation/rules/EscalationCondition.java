package com.learnguard.core.escalation.rules;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * One test of a rule. {@code threshold} is a confidence for safety checks and a count
 * for the keyword and repetition tests; {@code timeWindow} only matters for repetitions.
 */
@Value
@Builder
@Jacksonized
public class EscalationCondition {

    ConditionType type;
    double threshold;
    Duration timeWindow;

    public static EscalationCondition of(ConditionType type, double threshold) {
        return new EscalationCondition(type, threshold, null);
    }
}
