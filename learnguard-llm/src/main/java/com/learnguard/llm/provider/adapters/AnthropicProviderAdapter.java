package com.learnguard.llm.provider.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnguard.common.model.ConversationMessage;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.QueryType;
import com.learnguard.llm.config.LlmProperties;
import com.learnguard.llm.model.ModelCapabilities;
import com.learnguard.llm.prompt.EducationalPrompts;
import com.learnguard.llm.provider.AbstractProviderAdapter;
import com.learnguard.llm.provider.LlmProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class AnthropicProviderAdapter extends AbstractProviderAdapter {

    static final String OPUS = "claude-3-opus-20240229";
    static final String SONNET = "claude-3-sonnet-20240229";
    static final String HAIKU = "claude-3-haiku-20240307";

    private static final String API_VERSION = "2023-06-01";

    private static final Map<String, Integer> TOKEN_LIMITS = Map.of(
        OPUS, 200000,
        SONNET, 200000,
        HAIKU, 200000,
        "claude-2.1", 200000,
        "claude-2.0", 100000
    );

    private static final Map<String, Double> COSTS = Map.of(
        OPUS, 0.000075,
        SONNET, 0.000015,
        HAIKU, 0.000001,
        "claude-2.1", 0.000024,
        "claude-2.0", 0.000024
    );

    // No listing endpoint; known models
    private static final List<String> KNOWN_MODELS = List.of(OPUS, SONNET, HAIKU, "claude-2.1", "claude-2.0");

    public AnthropicProviderAdapter(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(LlmProvider.ANTHROPIC, properties.getAnthropic(),
            webClientBuilder.clone()
                .baseUrl(properties.getAnthropic().getBaseUrl())
                .defaultHeader("Content-Type", "application/json")
                .defaultHeader("anthropic-version", API_VERSION)
                .build(),
            objectMapper);
    }

    @Override
    protected Completion complete(LearningRequest request, String model) throws ProviderException {
        long startTime = System.currentTimeMillis();
        log.info("[ANTHROPIC] Starting completion | requestId={} | model={} | queryLength={}",
            request.getId(), model, request.getQuery().length());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", settings.getMaxOutputTokens());
        body.put("temperature", settings.getTemperature());
        body.put("system", EducationalPrompts.buildSystemPrompt(request));
        body.put("messages", buildMessages(request));

        try {
            Completion completion = parseCompletion(post(body));
            log.info("[ANTHROPIC] Completion received | requestId={} | model={} | durationMs={} | tokens={} | finishReason={}",
                request.getId(), model, System.currentTimeMillis() - startTime,
                completion.getTokensUsed(), completion.getFinishReason());
            return completion;

        } catch (WebClientResponseException e) {
            log.error("[ANTHROPIC] HTTP error | requestId={} | model={} | statusCode={} | durationMs={} | error={}",
                request.getId(), model, e.getStatusCode().value(), System.currentTimeMillis() - startTime, e.getMessage());
            throw mapException(e);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("[ANTHROPIC] Request failed | requestId={} | model={} | durationMs={} | error={}",
                request.getId(), model, System.currentTimeMillis() - startTime, e.getMessage());
            throw transportFailure(e);
        }
    }

    private String post(Map<String, Object> body) {
        return webClient.post()
            .uri("/messages")
            .header("x-api-key", settings.getApiKey())
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(settings.getTimeout())
            .block();
    }

    private List<Map<String, String>> buildMessages(LearningRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        for (ConversationMessage message : EducationalPrompts.recentHistory(request)) {
            String role = message.getRole() == ConversationMessage.Role.ASSISTANT ? "assistant" : "user";
            messages.add(Map.of("role", role, "content", EducationalPrompts.sanitize(message.getContent())));
        }
        messages.add(Map.of("role", "user", "content", EducationalPrompts.sanitize(request.getQuery())));
        return messages;
    }

    Completion parseCompletion(String response) throws ProviderException {
        try {
            JsonNode root = objectMapper.readTree(response);
            StringBuilder text = new StringBuilder();
            for (JsonNode block : root.path("content")) {
                if ("text".equals(block.path("type").asText())) {
                    text.append(block.path("text").asText());
                }
            }
            JsonNode usage = root.path("usage");
            int tokens = usage.path("input_tokens").asInt(0) + usage.path("output_tokens").asInt(0);
            return new Completion(text.toString(), mapStopReason(root.path("stop_reason").asText("")), tokens);
        } catch (Exception e) {
            throw malformedResponse(e);
        }
    }

    private FinishReason mapStopReason(String stopReason) {
        switch (stopReason) {
            case "end_turn":
                return FinishReason.COMPLETE;
            case "max_tokens":
                return FinishReason.TRUNCATED;
            default:
                return FinishReason.OTHER;
        }
    }

    @Override
    public String selectModel(LearningRequest request) {
        QueryType type = request.getQueryType();
        if (type == QueryType.CREATIVE_WRITING || type == QueryType.CONCEPT_EXPLANATION) {
            return SONNET;
        }
        if (type == QueryType.GENERAL_QUESTION) {
            return HAIKU;
        }
        return SONNET;
    }

    @Override
    public ModelCapabilities getCapabilities(String model) {
        String modelName = model != null ? model : getDefaultModel();
        return ModelCapabilities.builder()
            .provider(provider)
            .model(modelName)
            .maxTokens(TOKEN_LIMITS.getOrDefault(modelName, 100000))
            .supportsImages(modelName.contains("claude-3"))
            .supportsAudio(false)
            .supportsCode(true)
            .languages(List.of("en", "es", "fr", "de", "it", "pt", "ru", "ja", "ko", "zh"))
            .specialties(List.of(
                QueryType.GENERAL_QUESTION,
                QueryType.HOMEWORK_HELP,
                QueryType.CONCEPT_EXPLANATION,
                QueryType.PROBLEM_SOLVING,
                QueryType.CREATIVE_WRITING,
                QueryType.CODE_ASSISTANCE))
            .costPerToken(COSTS.getOrDefault(modelName, 0.000015))
            .averageResponseTimeMs(2500)
            .build();
    }

    @Override
    public boolean validateCredential() {
        Map<String, Object> probe = Map.of(
            "model", getDefaultModel(),
            "max_tokens", 10,
            "messages", List.of(Map.of("role", "user", "content", "test"))
        );
        try {
            post(probe);
            return true;
        } catch (Exception e) {
            log.warn("[ANTHROPIC] Credential validation failed | error={}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> listAvailableModels() {
        return KNOWN_MODELS;
    }
}
