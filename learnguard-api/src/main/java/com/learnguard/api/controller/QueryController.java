package com.learnguard.api.controller;

import com.learnguard.api.dto.request.QueryRequest;
import com.learnguard.api.dto.response.CostEstimateResponse;
import com.learnguard.common.model.InputType;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.util.TokenCounter;
import com.learnguard.core.coordinator.LearningRequestCoordinator;
import com.learnguard.llm.multimodal.MediaInput;
import com.learnguard.llm.multimodal.MultimodalInputProcessor;
import com.learnguard.llm.multimodal.ProcessedInput;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/queries")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

    private final LearningRequestCoordinator coordinator;
    private final MultimodalInputProcessor multimodalInput;

    @PostMapping
    public ResponseEntity<LearningResponse> query(@Valid @RequestBody QueryRequest request) {
        LearningRequest learningRequest = toLearningRequest(request);
        log.info("Query request - userId: {}, sessionId: {}, inputType: {}",
            request.getUserId(), request.getSessionId(), learningRequest.getInputType());
        return ResponseEntity.ok(coordinator.process(learningRequest));
    }

    @PostMapping("/estimate")
    public ResponseEntity<CostEstimateResponse> estimate(@Valid @RequestBody QueryRequest request) {
        LearningRequest learningRequest = toLearningRequest(request);
        return ResponseEntity.ok(CostEstimateResponse.builder()
            .queryTokens(TokenCounter.countTokens(learningRequest.getQuery()))
            .estimatedCost(coordinator.estimateCost(learningRequest))
            .build());
    }

    private LearningRequest toLearningRequest(QueryRequest request) {
        String query = request.getQuery();
        InputType inputType = InputType.TEXT;
        if (request.hasMedia()) {
            ProcessedInput processed = multimodalInput.process(MediaInput.builder()
                .text(request.getQuery())
                .audio(request.getAudio())
                .audioFormat(request.getAudioFormat())
                .image(request.getImage())
                .imageFormat(request.getImageFormat())
                .build());
            query = processed.getQueryText();
            inputType = processed.getInputType();
        }

        return LearningRequest.builder()
            .userId(request.getUserId())
            .sessionId(request.getSessionId())
            .query(query)
            .queryType(request.getQueryType())
            .inputType(inputType)
            .userProfile(request.getUserProfile())
            .courseContext(request.getCourseContext())
            .conversation(request.getConversation())
            .timestamp(Instant.now())
            .build();
    }
}
