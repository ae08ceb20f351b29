package com.learnguard.core.moderation.checks;

import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.core.moderation.CheckContext;
import com.learnguard.core.moderation.ModerationStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Uses the provider's own confidence as an accuracy proxy.
 */
@Component
@Order(130)
public class AccuracyChecker extends BaseSafetyChecker {

    public static final String TYPE = "accuracy";

    static final double MIN_CONFIDENCE = 0.7;

    public AccuracyChecker() {
        super(TYPE, SafetyLevel.LOW, SuggestedAction.FILTER, ModerationStage.OUTPUT);
    }

    @Override
    public boolean appliesTo(CheckContext context) {
        return context.getResponse() != null;
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        double confidence = context.getResponse().getConfidence();
        if (confidence >= MIN_CONFIDENCE) {
            return SafetyCheck.passed(TYPE, confidence, "Response confidence is acceptable");
        }
        return SafetyCheck.failed(TYPE, confidence, "Low response confidence: " + confidence);
    }
}
