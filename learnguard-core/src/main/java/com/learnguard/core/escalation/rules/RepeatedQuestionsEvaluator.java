package com.learnguard.core.escalation.rules;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
@RequiredArgsConstructor
public class RepeatedQuestionsEvaluator implements ConditionEvaluator {

    static final Duration DEFAULT_WINDOW = Duration.ofMinutes(30);

    private final RepeatedQuestionTracker tracker;

    @Override
    public ConditionType type() {
        return ConditionType.REPEATED_QUESTIONS;
    }

    @Override
    public boolean matches(EscalationCondition condition, EscalationContext context) {
        Duration window = condition.getTimeWindow() == null ? DEFAULT_WINDOW : condition.getTimeWindow();
        Instant askedAt = context.getRequest().getTimestamp() == null ? Instant.now() : context.getRequest().getTimestamp();
        int similar = tracker.countSimilar(context.getRequest().getUserId(), context.query(), window, askedAt);
        return similar >= condition.getThreshold();
    }
}
