package com.learnguard.core.moderation.checks;

import com.learnguard.common.model.ResponseMetadata;
import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.core.moderation.CheckContext;
import com.learnguard.core.moderation.ModerationStage;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(150)
public class SourceReliabilityChecker extends BaseSafetyChecker {

    public static final String TYPE = "source_reliability";

    public SourceReliabilityChecker() {
        super(TYPE, SafetyLevel.LOW, SuggestedAction.FILTER, ModerationStage.OUTPUT);
    }

    @Override
    public boolean appliesTo(CheckContext context) {
        return context.getResponse() != null;
    }

    @Override
    public SafetyCheck evaluate(String text, CheckContext context) {
        ResponseMetadata metadata = context.getResponse().getMetadata();
        if (metadata != null && metadata.hasSources()) {
            return SafetyCheck.passed(TYPE, 0.8, "Response cites course sources");
        }
        return SafetyCheck.failed(TYPE, 0.5, "No sources cited");
    }
}
