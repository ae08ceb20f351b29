package com.learnguard.api.dto.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CostEstimateResponse {
    private int queryTokens;
    private double estimatedCost;
}
