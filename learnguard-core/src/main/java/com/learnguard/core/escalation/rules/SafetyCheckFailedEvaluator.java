package com.learnguard.core.escalation.rules;

import com.learnguard.common.model.SafetyCheck;
import com.learnguard.core.moderation.checks.InappropriateTopicChecker;
import com.learnguard.core.moderation.checks.ProfanityChecker;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Matches when any failed check reaches the condition's confidence threshold, or when a
 * topic or profanity check failed with near certainty.
 */
@Component
public class SafetyCheckFailedEvaluator implements ConditionEvaluator {

    static final Set<String> HIGH_RISK_TYPES = Set.of(InappropriateTopicChecker.TYPE, ProfanityChecker.TYPE);
    static final double HIGH_RISK_CONFIDENCE = 0.9;

    @Override
    public ConditionType type() {
        return ConditionType.SAFETY_CHECK_FAILED;
    }

    @Override
    public boolean matches(EscalationCondition condition, EscalationContext context) {
        for (SafetyCheck check : context.getSafetyChecks()) {
            if (check.isPassed()) {
                continue;
            }
            if (check.getConfidence() >= condition.getThreshold()) {
                return true;
            }
            if (HIGH_RISK_TYPES.contains(check.getType()) && check.getConfidence() >= HIGH_RISK_CONFIDENCE) {
                return true;
            }
        }
        return false;
    }
}
