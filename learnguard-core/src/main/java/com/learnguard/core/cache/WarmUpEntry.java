package com.learnguard.core.cache;

import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import lombok.Value;

@Value
public class WarmUpEntry {

    LearningRequest request;
    LearningResponse response;
}
