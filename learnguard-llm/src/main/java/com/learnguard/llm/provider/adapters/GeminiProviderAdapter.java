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
import java.util.stream.StreamSupport;

@Component
@Slf4j
public class GeminiProviderAdapter extends AbstractProviderAdapter {

    static final String PRO = "gemini-1.5-pro";
    static final String FLASH = "gemini-1.5-flash";

    private static final Map<String, Integer> TOKEN_LIMITS = Map.of(
        PRO, 2097152,
        FLASH, 1048576
    );

    private static final Map<String, Double> COSTS = Map.of(
        PRO, 0.0000035,
        FLASH, 0.00000035
    );

    private static final int LARGE_CONTEXT_MATERIALS = 10;

    public GeminiProviderAdapter(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(LlmProvider.GEMINI, properties.getGemini(),
            webClientBuilder.clone()
                .baseUrl(properties.getGemini().getBaseUrl())
                .defaultHeader("Content-Type", "application/json")
                .build(),
            objectMapper);
    }

    @Override
    protected Completion complete(LearningRequest request, String model) throws ProviderException {
        long startTime = System.currentTimeMillis();
        log.info("[GEMINI] Starting completion | requestId={} | model={} | queryLength={}",
            request.getId(), model, request.getQuery().length());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("systemInstruction", Map.of("parts", List.of(
            Map.of("text", EducationalPrompts.buildSystemPrompt(request)))));
        body.put("contents", buildContents(request));
        body.put("generationConfig", Map.of(
            "maxOutputTokens", settings.getMaxOutputTokens(),
            "temperature", settings.getTemperature()
        ));

        try {
            String response = webClient.post()
                .uri("/models/{model}:generateContent?key={key}", model, settings.getApiKey())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(settings.getTimeout())
                .block();

            Completion completion = parseCompletion(response);
            log.info("[GEMINI] Completion received | requestId={} | model={} | durationMs={} | tokens={} | finishReason={}",
                request.getId(), model, System.currentTimeMillis() - startTime,
                completion.getTokensUsed(), completion.getFinishReason());
            return completion;

        } catch (WebClientResponseException e) {
            log.error("[GEMINI] HTTP error | requestId={} | model={} | statusCode={} | durationMs={} | error={}",
                request.getId(), model, e.getStatusCode().value(), System.currentTimeMillis() - startTime, e.getMessage());
            throw mapException(e);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("[GEMINI] Request failed | requestId={} | model={} | durationMs={} | error={}",
                request.getId(), model, System.currentTimeMillis() - startTime, e.getMessage());
            throw transportFailure(e);
        }
    }

    private List<Map<String, Object>> buildContents(LearningRequest request) {
        List<Map<String, Object>> contents = new ArrayList<>();
        for (ConversationMessage message : EducationalPrompts.recentHistory(request)) {
            String role = message.getRole() == ConversationMessage.Role.ASSISTANT ? "model" : "user";
            contents.add(Map.of("role", role, "parts", List.of(
                Map.of("text", EducationalPrompts.sanitize(message.getContent())))));
        }
        contents.add(Map.of("role", "user", "parts", List.of(
            Map.of("text", EducationalPrompts.sanitize(request.getQuery())))));
        return contents;
    }

    Completion parseCompletion(String response) throws ProviderException {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode candidate = root.path("candidates").get(0);
            StringBuilder text = new StringBuilder();
            for (JsonNode part : candidate.path("content").path("parts")) {
                text.append(part.path("text").asText(""));
            }
            int tokens = root.path("usageMetadata").path("totalTokenCount").asInt(0);
            return new Completion(text.toString(), mapFinishReason(candidate.path("finishReason").asText("")), tokens);
        } catch (Exception e) {
            throw malformedResponse(e);
        }
    }

    private FinishReason mapFinishReason(String finishReason) {
        switch (finishReason) {
            case "STOP":
                return FinishReason.COMPLETE;
            case "MAX_TOKENS":
                return FinishReason.TRUNCATED;
            default:
                return FinishReason.OTHER;
        }
    }

    @Override
    public String selectModel(LearningRequest request) {
        QueryType type = request.getQueryType();
        if (type == QueryType.CODE_ASSISTANCE
            || type == QueryType.MATH_PROBLEM
            || type == QueryType.PROBLEM_SOLVING
            || request.materialCount() > LARGE_CONTEXT_MATERIALS) {
            return PRO;
        }
        return FLASH;
    }

    @Override
    public ModelCapabilities getCapabilities(String model) {
        String modelName = model != null ? model : getDefaultModel();
        return ModelCapabilities.builder()
            .provider(provider)
            .model(modelName)
            .maxTokens(TOKEN_LIMITS.getOrDefault(modelName, 1048576))
            .supportsImages(true)
            .supportsAudio(true)
            .supportsCode(true)
            .languages(List.of("en", "es", "fr", "de", "it", "pt", "ja", "ko", "zh", "hi"))
            .specialties(List.of(
                QueryType.GENERAL_QUESTION,
                QueryType.CONCEPT_EXPLANATION,
                QueryType.MATH_PROBLEM,
                QueryType.LANGUAGE_LEARNING))
            .costPerToken(COSTS.getOrDefault(modelName, 0.00000035))
            .averageResponseTimeMs(1800)
            .build();
    }

    @Override
    public boolean validateCredential() {
        try {
            fetchModels();
            return true;
        } catch (Exception e) {
            log.warn("[GEMINI] Credential validation failed | error={}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> listAvailableModels() {
        try {
            JsonNode models = fetchModels().path("models");
            return StreamSupport.stream(models.spliterator(), false)
                .map(node -> node.path("name").asText().replace("models/", ""))
                .filter(name -> name.contains("gemini"))
                .sorted()
                .toList();
        } catch (Exception e) {
            log.warn("[GEMINI] Model listing failed, using static table | error={}", e.getMessage());
            return List.of(PRO, FLASH);
        }
    }

    private JsonNode fetchModels() throws Exception {
        String response = webClient.get()
            .uri("/models?key={key}", settings.getApiKey())
            .retrieve()
            .bodyToMono(String.class)
            .timeout(settings.getTimeout())
            .block();
        return objectMapper.readTree(response);
    }
}
