package com.learnguard.core.moderation.checks;

import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.core.moderation.CheckContext;
import com.learnguard.core.moderation.ModerationStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Inappropriate-topic screen applied to generated answers.
 */
@Component
@Order(110)
public class ResponseContentChecker extends BaseSafetyChecker {

    public static final String TYPE = "response_content";

    public ResponseContentChecker() {
        super(TYPE, SafetyLevel.HIGH, SuggestedAction.BLOCK, ModerationStage.OUTPUT);
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        List<String> found = InappropriateTopicChecker.TOPIC_MATCHER.found(lower(text));
        if (found.isEmpty()) {
            return SafetyCheck.passed(TYPE, 0.9, "Response content is appropriate");
        }
        return SafetyCheck.failed(TYPE, 0.8, "Response mentions: " + String.join(", ", found));
    }
}
