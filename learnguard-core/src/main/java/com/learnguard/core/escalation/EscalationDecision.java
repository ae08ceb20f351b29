package com.learnguard.core.escalation;

import com.learnguard.common.model.SafetyLevel;
import com.learnguard.core.escalation.rules.EscalationAction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EscalationDecision {

    boolean shouldEscalate;
    String reason;
    SafetyLevel severity;
    /** Rule that fired, null for the distress and safety-violation short-circuits. */
    String ruleId;
    EscalationAction action;
    @Singular
    List<String> channels;

    public static EscalationDecision none() {
        return EscalationDecision.builder().shouldEscalate(false).build();
    }
}
