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
@Order(120)
public class EducationalValueChecker extends BaseSafetyChecker {

    public static final String TYPE = "educational_value";

    static final List<String> INDICATORS = List.of(
        "learn", "understand", "concept", "explain", "because", "therefore", "example",
        "practice", "study", "knowledge", "skill", "process", "observation", "experimentation",
        "science", "plants", "energy", "convert", "transform"
    );

    private static final KeywordMatcher INDICATOR_MATCHER = KeywordMatcher.of(INDICATORS);

    private static final int MIN_INDICATORS = 1;

    public EducationalValueChecker() {
        super(TYPE, SafetyLevel.LOW, SuggestedAction.FILTER, ModerationStage.OUTPUT);
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        long count = INDICATOR_MATCHER.count(lower(text));
        if (count >= MIN_INDICATORS) {
            return SafetyCheck.passed(TYPE, 0.8, "Educational indicators found: " + count);
        }
        return SafetyCheck.failed(TYPE, 0.6, "Response lacks educational content");
    }
}
