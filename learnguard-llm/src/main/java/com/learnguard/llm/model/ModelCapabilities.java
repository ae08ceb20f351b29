package com.learnguard.llm.model;

import com.learnguard.common.model.QueryType;
import com.learnguard.llm.provider.LlmProvider;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ModelCapabilities {

    LlmProvider provider;
    String model;
    int maxTokens;
    boolean supportsImages;
    boolean supportsAudio;
    boolean supportsCode;
    @Singular
    List<String> languages;
    @Singular
    List<QueryType> specialties;
    double costPerToken;
    long averageResponseTimeMs;
}
