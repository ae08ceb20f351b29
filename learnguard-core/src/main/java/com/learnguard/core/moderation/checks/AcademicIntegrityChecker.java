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
import java.util.regex.Pattern;

/**
 * Flags requests for finished answers instead of help understanding them.
 */
@Component
@Order(50)
public class AcademicIntegrityChecker extends BaseSafetyChecker {

    public static final String TYPE = "academic_integrity";

    static final List<String> DIRECT_ANSWER_REQUESTS = List.of(
        "give me the answer", "what is the answer to", "solve this for me",
        "do my homework", "complete this assignment", "write my essay"
    );

    private static final KeywordMatcher DIRECT_ANSWER_MATCHER = KeywordMatcher.of(DIRECT_ANSWER_REQUESTS);

    private static final List<Pattern> CHEATING_PATTERNS = List.of(
        Pattern.compile("copy.*paste"),
        Pattern.compile("plagiarize"),
        Pattern.compile("cheat.*test"),
        Pattern.compile("exam.*answers"),
        Pattern.compile("homework.*answers")
    );

    public AcademicIntegrityChecker() {
        super(TYPE, SafetyLevel.MEDIUM, SuggestedAction.FILTER, ModerationStage.INPUT);
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        String lower = lower(text);
        List<String> requests = DIRECT_ANSWER_MATCHER.found(lower);
        if (!requests.isEmpty()) {
            return SafetyCheck.failed(TYPE, 0.8, "Direct answer requested: " + requests.get(0));
        }
        for (Pattern pattern : CHEATING_PATTERNS) {
            if (pattern.matcher(lower).find()) {
                return SafetyCheck.failed(TYPE, 0.8, "Possible cheating attempt: " + pattern.pattern());
            }
        }
        return SafetyCheck.passed(TYPE, 0.3, "No academic integrity concerns");
    }
}
