package com.learnguard.core.escalation.rules;

import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.SafetyCheck;
import lombok.Value;

import java.util.List;

/**
 * Inputs to one escalation evaluation. {@code response} is null when the question was
 * redirected before generation.
 */
@Value
public class EscalationContext {

    LearningRequest request;
    List<SafetyCheck> safetyChecks;
    LearningResponse response;

    public String query() {
        return request.getQuery() == null ? "" : request.getQuery();
    }
}
