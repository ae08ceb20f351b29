package com.learnguard.core.moderation.checks;

import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.common.util.KeywordMatcher;
import com.learnguard.core.moderation.CheckContext;
import com.learnguard.core.moderation.ModerationStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compares content categories mentioned in the text against a minimum-age table.
 * Only runs when the learner's age is known or can be derived from the grade.
 */
@Component
@Order(30)
public class AgeAppropriatenessChecker extends BaseSafetyChecker {

    public static final String TYPE = "age_inappropriate";

    static final Map<String, Integer> MINIMUM_AGES = new LinkedHashMap<>();

    static {
        MINIMUM_AGES.put("violence", 13);
        MINIMUM_AGES.put("mature themes", 16);
        MINIMUM_AGES.put("complex political topics", 14);
        MINIMUM_AGES.put("advanced scientific concepts", 12);
        MINIMUM_AGES.put("financial advice", 16);
        MINIMUM_AGES.put("medical advice", 18);
        MINIMUM_AGES.put("legal advice", 18);
    }

    public AgeAppropriatenessChecker() {
        super(TYPE, SafetyLevel.HIGH, SuggestedAction.BLOCK, ModerationStage.INPUT, ModerationStage.OUTPUT);
    }

    @Override
    public boolean appliesTo(CheckContext context) {
        return context.learnerAge() != null;
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        int age = context.learnerAge();
        String lower = lower(text);
        for (Map.Entry<String, Integer> entry : MINIMUM_AGES.entrySet()) {
            if (KeywordMatcher.containsPhrase(lower, entry.getKey()) && age < entry.getValue()) {
                return SafetyCheck.failed(TYPE, 0.8,
                    "Content requires minimum age of " + entry.getValue() + ", user is " + age);
            }
        }
        return SafetyCheck.passed(TYPE, 0.9, "Content is age-appropriate");
    }
}
