package com.learnguard.core.escalation.rules;

import com.learnguard.common.model.SafetyLevel;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Rule table used when {@code learnguard.escalation.rules} is not configured.
 */
public final class DefaultEscalationRules {

    private DefaultEscalationRules() {}

    public static List<EscalationRule> create() {
        return List.of(
            EscalationRule.builder()
                .id("safety-violation-high")
                .name("High-risk safety violation")
                .condition(EscalationCondition.of(ConditionType.SAFETY_CHECK_FAILED, 0.8))
                .action(EscalationAction.notifyTeacher(Map.of(EscalationAction.URGENCY, "immediate")))
                .priority(SafetyLevel.CRITICAL)
                .channels(List.of("email", "sms", "in_app"))
                .build(),
            EscalationRule.builder()
                .id("emotional-distress")
                .name("Emotional distress detected")
                .condition(EscalationCondition.of(ConditionType.EMOTIONAL_DISTRESS, 2))
                .action(EscalationAction.notifyTeacher(Map.of(
                    EscalationAction.URGENCY, "urgent",
                    EscalationAction.INVOLVE_COUNSELOR, "true")))
                .priority(SafetyLevel.CRITICAL)
                .channels(List.of("email", "sms", "in_app"))
                .build(),
            EscalationRule.builder()
                .id("repeated-confusion")
                .name("Repeated confusion")
                .condition(EscalationCondition.builder()
                    .type(ConditionType.REPEATED_QUESTIONS)
                    .threshold(3)
                    .timeWindow(Duration.ofMinutes(30))
                    .build())
                .action(EscalationAction.notifyTeacher(Map.of(EscalationAction.INTERVENTION_NEEDED, "true")))
                .priority(SafetyLevel.MEDIUM)
                .channels(List.of("email", "in_app"))
                .build(),
            EscalationRule.builder()
                .id("complex-academic")
                .name("Complex academic question")
                .condition(EscalationCondition.of(ConditionType.COMPLEX_ACADEMIC, 1))
                .action(EscalationAction.notifyTeacher(Map.of(EscalationAction.EXPERTISE_NEEDED, "true")))
                .priority(SafetyLevel.LOW)
                .channels(List.of("in_app"))
                .build()
        );
    }
}
