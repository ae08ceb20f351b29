package com.learnguard.core.escalation.rules;

/**
 * Decides one kind of {@link EscalationCondition}. One implementation per {@link ConditionType}.
 */
public interface ConditionEvaluator {

    ConditionType type();

    boolean matches(EscalationCondition condition, EscalationContext context);
}
