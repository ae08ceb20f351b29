package com.learnguard.core.moderation;

import com.learnguard.common.model.LearnerProfile;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import lombok.Value;

/**
 * What a checker may look at besides the text itself. {@code response} is null on the input stage.
 */
@Value
public class CheckContext {

    ModerationStage stage;
    LearningRequest request;
    LearningResponse response;

    public static CheckContext forInput(LearningRequest request) {
        return new CheckContext(ModerationStage.INPUT, request, null);
    }

    public static CheckContext forOutput(LearningRequest request, LearningResponse response) {
        return new CheckContext(ModerationStage.OUTPUT, request, response);
    }

    public LearnerProfile profile() {
        return request == null ? null : request.getUserProfile();
    }

    public Integer learnerAge() {
        return request == null ? null : request.learnerAge();
    }
}
