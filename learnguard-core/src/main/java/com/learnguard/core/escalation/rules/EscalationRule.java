package com.learnguard.core.escalation.rules;

import com.learnguard.common.model.SafetyLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Fires when every condition holds. Rules are evaluated in table order and never
 * look at each other.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EscalationRule {

    String id;
    String name;
    @Builder.Default
    boolean enabled = true;
    @Singular
    List<EscalationCondition> conditions;
    EscalationAction action;
    SafetyLevel priority;
    @Singular
    List<String> channels;
}
