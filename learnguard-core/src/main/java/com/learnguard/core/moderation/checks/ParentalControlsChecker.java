package com.learnguard.core.moderation.checks;

import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.common.util.KeywordMatcher;
import com.learnguard.core.moderation.CheckContext;
import com.learnguard.core.moderation.ModerationStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(40)
public class ParentalControlsChecker extends BaseSafetyChecker {

    public static final String TYPE = "parental_controls";

    public ParentalControlsChecker() {
        super(TYPE, SafetyLevel.HIGH, SuggestedAction.BLOCK, ModerationStage.INPUT);
    }

    @Override
    public boolean appliesTo(CheckContext context) {
        return context.profile() != null && context.profile().hasParentalControls();
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        String lower = lower(text);
        List<String> restricted = context.profile().getParentalControls().getRestrictedTopics().stream()
            .filter(topic -> topic != null && !topic.isBlank())
            .filter(topic -> KeywordMatcher.containsPhrase(lower, topic))
            .toList();
        if (restricted.isEmpty()) {
            return SafetyCheck.passed(TYPE, 0.9, "Content allowed by parental controls");
        }
        return SafetyCheck.failed(TYPE, 0.9, "Restricted by parental controls: " + String.join(", ", restricted));
    }
}
