package com.learnguard.core.moderation.checks;

import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.common.util.KeywordMatcher;
import com.learnguard.core.moderation.CheckContext;
import com.learnguard.core.moderation.ModerationStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@Order(20)
public class InappropriateTopicChecker extends BaseSafetyChecker {

    public static final String TYPE = "inappropriate_topic";

    public static final List<String> TOPICS = List.of(
        "violence", "drugs", "alcohol", "weapons", "gambling", "adult content",
        "self-harm", "suicide", "illegal activities", "hate speech", "discrimination"
    );

    /** Statements of intent to harm self or others. */
    public static final List<String> HARM_PHRASES = List.of(
        "hurt someone", "harm others", "want to kill", "want to die"
    );

    static final KeywordMatcher TOPIC_MATCHER = KeywordMatcher.of(TOPICS);
    private static final KeywordMatcher HARM_MATCHER = KeywordMatcher.of(HARM_PHRASES);

    public InappropriateTopicChecker() {
        super(TYPE, SafetyLevel.HIGH, SuggestedAction.BLOCK, ModerationStage.INPUT);
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        String lower = lower(text);
        List<String> found = new ArrayList<>(TOPIC_MATCHER.found(lower));
        found.addAll(HARM_MATCHER.found(lower));
        if (found.isEmpty()) {
            return SafetyCheck.passed(TYPE, 0.2, "No inappropriate topics detected");
        }
        return SafetyCheck.failed(TYPE, 0.9, "Inappropriate topics detected: " + String.join(", ", found));
    }
}
