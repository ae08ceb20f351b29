package com.learnguard.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.ResponseMetadata;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.llm.router.NoProviderAvailableException;
import com.learnguard.llm.router.ProviderOrchestrator;
import com.learnguard.llm.router.ProviderOrchestrator.ProviderFailoverException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class QueryControllerTest {

    private static final String ANSWER = "Photosynthesis is how plants turn light into chemical energy.";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ProviderOrchestrator orchestrator;

    static LearningResponse answer(String text) {
        return LearningResponse.builder()
            .id("resp-1")
            .text(text)
            .provider("openai")
            .model("gpt-3.5-turbo")
            .confidence(0.9)
            .safetyLevel(SafetyLevel.LOW)
            .tokensUsed(40)
            .timestamp(Instant.now())
            .metadata(ResponseMetadata.empty())
            .build();
    }

    private static Map<String, Object> question(String userId, String query) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId);
        body.put("sessionId", userId + "-session");
        body.put("query", query);
        return body;
    }

    private ResultActions send(String path, Map<String, Object> body) throws Exception {
        return mockMvc.perform(post(path)
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(body)));
    }

    @Test
    void answersQuestionAndServesRepeatFromCache() throws Exception {
        when(orchestrator.generateWithFailover(any())).thenReturn(answer(ANSWER));

        send("/api/v1/queries", question("query-user-1", "What is photosynthesis?"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.text").value(ANSWER))
            .andExpect(jsonPath("$.provider").value("openai"))
            .andExpect(jsonPath("$.cached").value(false));

        send("/api/v1/queries", question("query-user-1", "what is photosynthesis"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cached").value(true));
    }

    @Test
    void harmfulQuestionIsRedirected() throws Exception {
        send("/api/v1/queries", question("query-user-2", "I want to hurt someone"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.provider").value(LearningResponse.SAFETY_FILTER_PROVIDER))
            .andExpect(jsonPath("$.safetyLevel").value("high"))
            .andExpect(jsonPath("$.metadata.escalationRecommended").value(true));

        verify(orchestrator, never()).generateWithFailover(any());
    }

    @Test
    void missingUserIsValidationError() throws Exception {
        Map<String, Object> body = question("query-user-3", "What is photosynthesis?");
        body.remove("userId");

        send("/api/v1/queries", body)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.message").value("Validation failed"));
    }

    @Test
    void blankQueryIsBadRequest() throws Exception {
        send("/api/v1/queries", question("query-user-4", "  "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.path").value("/api/v1/queries"));
    }

    @Test
    void unknownQueryTypeIsBadRequest() throws Exception {
        Map<String, Object> body = question("query-user-5", "What is photosynthesis?");
        body.put("queryType", "fortune_telling");

        send("/api/v1/queries", body).andExpect(status().isBadRequest());
    }

    @Test
    void imageWithoutDescriptionServiceIsBadRequest() throws Exception {
        Map<String, Object> body = question("query-user-6", "What is in this picture?");
        body.put("image", "aGVsbG8=");
        body.put("imageFormat", "png");

        send("/api/v1/queries", body)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Image description service is not configured"));
    }

    @Test
    void noProviderIsServiceUnavailable() throws Exception {
        when(orchestrator.generateWithFailover(any())).thenThrow(new NoProviderAvailableException("No LLM providers are registered"));

        send("/api/v1/queries", question("query-user-7", "What is photosynthesis?"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value(503));
    }

    @Test
    void failoverIsBadGateway() throws Exception {
        when(orchestrator.generateWithFailover(any()))
            .thenThrow(new ProviderFailoverException("All providers failed", List.of(), null));

        send("/api/v1/queries", question("query-user-8", "What is photosynthesis?"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.status").value(502));
    }

    @Test
    void estimatesCost() throws Exception {
        when(orchestrator.estimateCost(any())).thenReturn(0.0021);

        send("/api/v1/queries/estimate", question("query-user-9", "What is photosynthesis?"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.estimatedCost").value(0.0021))
            .andExpect(jsonPath("$.queryTokens").isNumber());
    }
}
