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
@Order(140)
public class BiasChecker extends BaseSafetyChecker {

    public static final String TYPE = "bias";

    static final List<String> ABSOLUTIST_PHRASES = List.of(
        "always", "never", "all people", "everyone knows", "obviously",
        "clearly", "definitely", "certainly", "without doubt"
    );

    private static final KeywordMatcher ABSOLUTIST_MATCHER = KeywordMatcher.of(ABSOLUTIST_PHRASES);

    static final int THRESHOLD = 3;

    public BiasChecker() {
        super(TYPE, SafetyLevel.LOW, SuggestedAction.FILTER, ModerationStage.OUTPUT);
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        List<String> found = ABSOLUTIST_MATCHER.found(lower(text));
        if (found.size() >= THRESHOLD) {
            return SafetyCheck.failed(TYPE, 0.7, "Absolutist language: " + String.join(", ", found));
        }
        return SafetyCheck.passed(TYPE, 0.8, "No significant bias detected");
    }
}
