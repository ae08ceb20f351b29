package com.learnguard.core.moderation.checks;

import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.common.util.QueryNormalizer;
import com.learnguard.core.moderation.CheckContext;
import com.learnguard.core.moderation.ModerationStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
@Order(10)
public class ProfanityChecker extends BaseSafetyChecker {

    public static final String TYPE = "profanity";

    static final Set<String> BANNED_WORDS = Set.of(
        "damn", "hell", "crap", "stupid", "idiot", "hate", "kill", "die", "death"
    );

    public ProfanityChecker() {
        super(TYPE, SafetyLevel.MEDIUM, SuggestedAction.FILTER, ModerationStage.INPUT, ModerationStage.OUTPUT);
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        // whole words only: "skill" and "shell" are fine
        List<String> found = QueryNormalizer.words(text).stream()
            .filter(BANNED_WORDS::contains)
            .toList();
        if (found.isEmpty()) {
            return SafetyCheck.passed(TYPE, 0.1, "No profanity detected");
        }
        return SafetyCheck.failed(TYPE, 0.9, "Profanity detected: " + String.join(", ", found));
    }
}
