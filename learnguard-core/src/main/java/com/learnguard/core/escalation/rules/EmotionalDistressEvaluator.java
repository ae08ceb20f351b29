package com.learnguard.core.escalation.rules;

import com.learnguard.common.util.KeywordMatcher;
import com.learnguard.core.moderation.checks.InappropriateTopicChecker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class EmotionalDistressEvaluator implements ConditionEvaluator {

    static final List<String> DISTRESS_KEYWORDS = List.of(
        "stressed", "anxious", "worried", "scared", "confused", "lost",
        "don't understand", "failing", "give up", "hopeless", "frustrated"
    );

    private static final KeywordMatcher DISTRESS_MATCHER = KeywordMatcher.of(DISTRESS_KEYWORDS);

    /**
     * Phrases that escalate at critical severity before any rule is consulted.
     */
    static final List<String> ACUTE_PHRASES;
    private static final KeywordMatcher ACUTE_MATCHER;

    static {
        List<String> phrases = new ArrayList<>(List.of(
            "stressed", "anxious", "worried", "scared", "confused", "lost",
            "don't understand anything", "failing", "give up", "hopeless",
            "want to give up", "so stressed", "so confused"
        ));
        phrases.addAll(InappropriateTopicChecker.HARM_PHRASES);
        ACUTE_PHRASES = List.copyOf(phrases);
        ACUTE_MATCHER = KeywordMatcher.of(ACUTE_PHRASES);
    }

    @Override
    public ConditionType type() {
        return ConditionType.EMOTIONAL_DISTRESS;
    }

    @Override
    public boolean matches(EscalationCondition condition, EscalationContext context) {
        long count = DISTRESS_MATCHER.count(context.query());
        return count >= condition.getThreshold();
    }

    public static boolean isAcute(String query) {
        return ACUTE_MATCHER.matchesAny(query);
    }
}
