package com.learnguard.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnguard.common.model.CourseMaterial;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.QueryType;
import com.learnguard.common.model.ResponseMetadata;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.util.KeywordMatcher;
import com.learnguard.common.util.TokenCounter;
import com.learnguard.llm.config.LlmProperties;
import lombok.Value;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Shared request validation, cost estimation and response annotation.
 * Subclasses only implement the backend call in {@link #complete(LearningRequest, String)}.
 */
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    private static final KeywordMatcher CRITICAL_KEYWORDS = KeywordMatcher.of(List.of("suicide", "self-harm", "violence", "illegal"));
    private static final KeywordMatcher HIGH_RISK_KEYWORDS = KeywordMatcher.of(List.of("inappropriate", "adult content", "dangerous"));
    private static final KeywordMatcher UNCERTAINTY_PHRASES = KeywordMatcher.of(List.of(
        "i don't know",
        "i'm not sure",
        "you should ask your teacher",
        "this is beyond my knowledge",
        "complex topic"
    ));
    private static final double SOURCE_RELEVANCE_THRESHOLD = 0.7;
    private static final int MAX_SOURCES = 3;
    private static final int MAX_ESTIMATED_OUTPUT_TOKENS = 1000;

    private static final Map<QueryType, List<String>> FOLLOW_UPS = new EnumMap<>(QueryType.class);

    static {
        FOLLOW_UPS.put(QueryType.GENERAL_QUESTION, List.of(
            "Would you like me to explain any part in more detail?",
            "Do you have any follow-up questions?"));
        FOLLOW_UPS.put(QueryType.HOMEWORK_HELP, List.of(
            "Can you try solving a similar problem?",
            "What part of this concept would you like to practice more?"));
        FOLLOW_UPS.put(QueryType.CONCEPT_EXPLANATION, List.of(
            "Would you like to see an example of this concept?",
            "How does this relate to what you've learned before?"));
        FOLLOW_UPS.put(QueryType.PROBLEM_SOLVING, List.of(
            "Can you walk me through your thinking process?",
            "What would you try differently next time?"));
        FOLLOW_UPS.put(QueryType.CREATIVE_WRITING, List.of(
            "What inspired this idea?",
            "How could you develop this further?"));
        FOLLOW_UPS.put(QueryType.CODE_ASSISTANCE, List.of(
            "Can you explain what this code does?",
            "What would happen if we changed this part?"));
        FOLLOW_UPS.put(QueryType.MATH_PROBLEM, List.of(
            "Can you solve a similar problem on your own?",
            "What mathematical concept does this demonstrate?"));
        FOLLOW_UPS.put(QueryType.LANGUAGE_LEARNING, List.of(
            "Can you use this in a sentence?",
            "What other words are related to this?"));
    }

    protected final LlmProvider provider;
    protected final LlmProperties.ProviderSettings settings;
    protected final ObjectMapper objectMapper;
    protected final WebClient webClient;

    protected AbstractProviderAdapter(LlmProvider provider,
                                      LlmProperties.ProviderSettings settings,
                                      WebClient webClient,
                                      ObjectMapper objectMapper) {
        this.provider = provider;
        this.settings = settings;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Raw backend call. Must map transport and HTTP failures into {@link ProviderException}.
     */
    protected abstract Completion complete(LearningRequest request, String model) throws ProviderException;

    @Override
    public LearningResponse generateResponse(LearningRequest request, String model) throws ProviderException {
        validateRequest(request);
        String effectiveModel = model != null ? model : getDefaultModel();
        long startTime = System.currentTimeMillis();
        Completion completion = complete(request, effectiveModel);
        return toResponse(request, effectiveModel, completion, System.currentTimeMillis() - startTime);
    }

    @Override
    public double estimateCost(LearningRequest request, String model) {
        String effectiveModel = model != null ? model : getDefaultModel();
        int inputTokens = TokenCounter.countTokens(request.getQuery());
        int estimatedOutputTokens = Math.min(inputTokens * 2, MAX_ESTIMATED_OUTPUT_TOKENS);
        return (inputTokens + estimatedOutputTokens) * getCapabilities(effectiveModel).getCostPerToken();
    }

    @Override
    public LlmProvider getProvider() {
        return provider;
    }

    @Override
    public String getDefaultModel() {
        return settings.getDefaultModel();
    }

    @Override
    public boolean isConfigured() {
        return settings.hasApiKey();
    }

    protected void validateRequest(LearningRequest request) throws ProviderException {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            throw new ProviderException("Query cannot be empty", provider, 400, false);
        }
        if (request.getUserId() == null) {
            throw new ProviderException("User ID is required", provider, 400, false);
        }
        if (request.getSessionId() == null) {
            throw new ProviderException("Session ID is required", provider, 400, false);
        }
    }

    protected LearningResponse toResponse(LearningRequest request, String model, Completion completion, long latencyMs) {
        String text = completion.getText() == null ? "" : completion.getText();
        int tokensUsed = completion.getTokensUsed() > 0
            ? completion.getTokensUsed()
            : TokenCounter.countTokens(request.getQuery(), text);

        return LearningResponse.builder()
            .id(provider.getCode() + "_" + UUID.randomUUID())
            .requestId(request.getId())
            .text(text)
            .provider(provider.getCode())
            .model(model)
            .confidence(confidenceFor(completion))
            .safetyLevel(assessSafetyLevel(text))
            .tokensUsed(tokensUsed)
            .latencyMs(latencyMs)
            .cached(false)
            .metadata(ResponseMetadata.builder()
                .sources(extractSources(request))
                .suggestedFollowUps(followUpsFor(request.getQueryType()))
                .escalationRecommended(expressesUncertainty(text))
                .build())
            .build();
    }

    static double confidenceFor(Completion completion) {
        String text = completion.getText() == null ? "" : completion.getText();
        switch (completion.getFinishReason()) {
            case COMPLETE:
                return text.length() > 50 ? 0.9 : 0.5;
            case TRUNCATED:
                return 0.7;
            default:
                return 0.5;
        }
    }

    static SafetyLevel assessSafetyLevel(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (CRITICAL_KEYWORDS.matchesAny(lower)) {
            return SafetyLevel.CRITICAL;
        }
        if (HIGH_RISK_KEYWORDS.matchesAny(lower)) {
            return SafetyLevel.HIGH;
        }
        return SafetyLevel.LOW;
    }

    static boolean expressesUncertainty(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return UNCERTAINTY_PHRASES.matchesAny(lower);
    }

    static List<String> extractSources(LearningRequest request) {
        if (request.getCourseContext() == null) {
            return List.of();
        }
        return request.getCourseContext().getMaterials().stream()
            .filter(material -> material.getRelevanceScore() != null
                && material.getRelevanceScore() > SOURCE_RELEVANCE_THRESHOLD)
            .map(CourseMaterial::getTitle)
            .filter(Objects::nonNull)
            .limit(MAX_SOURCES)
            .toList();
    }

    static List<String> followUpsFor(QueryType queryType) {
        return FOLLOW_UPS.getOrDefault(queryType, FOLLOW_UPS.get(QueryType.GENERAL_QUESTION));
    }

    protected ProviderException mapException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        // 429 (Rate Limit) and 5xx (Server Errors) are retryable
        boolean retryable = status == 429 || status >= 500;
        String message = String.format("%s API error: %d %s", provider.getDisplayName(), status, e.getStatusText());

        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString());
            if (error.has("error") && error.get("error").has("message")) {
                message = error.get("error").get("message").asText();
            }
        } catch (Exception ignored) {
            // body is not JSON; keep the status line
        }

        return new ProviderException(message, provider, status, retryable, e);
    }

    protected ProviderException transportFailure(Exception e) {
        return new ProviderException(
            provider.getDisplayName() + " request failed: " + e.getMessage(),
            provider, 500, true, e
        );
    }

    protected ProviderException malformedResponse(Exception e) {
        return new ProviderException(
            "Failed to parse " + provider.getDisplayName() + " response",
            provider, 500, false, e
        );
    }

    /**
     * Backend-neutral view of one completion.
     */
    @Value
    public static class Completion {
        String text;
        FinishReason finishReason;
        int tokensUsed;
    }

    public enum FinishReason {
        COMPLETE,
        TRUNCATED,
        OTHER
    }
}
