package com.learnguard.core.escalation.rules;

import com.learnguard.common.util.KeywordMatcher;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ComplexAcademicEvaluator implements ConditionEvaluator {

    static final List<String> COMPLEXITY_KEYWORDS = List.of(
        "advanced", "graduate", "research", "thesis", "dissertation",
        "theoretical", "abstract", "philosophical", "quantum", "molecular"
    );

    private static final KeywordMatcher MATCHER = KeywordMatcher.of(COMPLEXITY_KEYWORDS);

    @Override
    public ConditionType type() {
        return ConditionType.COMPLEX_ACADEMIC;
    }

    @Override
    public boolean matches(EscalationCondition condition, EscalationContext context) {
        long count = MATCHER.count(context.query());
        return count >= Math.max(1.0, condition.getThreshold());
    }
}
