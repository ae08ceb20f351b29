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
public class OpenAiProviderAdapter extends AbstractProviderAdapter {

    static final String GPT_35 = "gpt-3.5-turbo";
    static final String GPT_35_16K = "gpt-3.5-turbo-16k";
    static final String GPT_4 = "gpt-4";

    private static final Map<String, Integer> TOKEN_LIMITS = Map.of(
        GPT_35, 4096,
        GPT_35_16K, 16384,
        GPT_4, 8192,
        "gpt-4-32k", 32768,
        "gpt-4-turbo", 128000
    );

    // USD per token, approximate
    private static final Map<String, Double> COSTS = Map.of(
        GPT_35, 0.000002,
        GPT_4, 0.00003,
        "gpt-4-turbo", 0.00001
    );

    private static final int LARGE_CONTEXT_MATERIALS = 10;

    public OpenAiProviderAdapter(LlmProperties properties, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(LlmProvider.OPENAI, properties.getOpenai(),
            webClientBuilder.clone()
                .baseUrl(properties.getOpenai().getBaseUrl())
                .defaultHeader("Content-Type", "application/json")
                .build(),
            objectMapper);
    }

    @Override
    protected Completion complete(LearningRequest request, String model) throws ProviderException {
        long startTime = System.currentTimeMillis();
        log.info("[OPENAI] Starting completion | requestId={} | model={} | queryLength={}",
            request.getId(), model, request.getQuery().length());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", buildMessages(request));
        body.put("max_tokens", settings.getMaxOutputTokens());
        body.put("temperature", settings.getTemperature());
        body.put("presence_penalty", 0.1);
        body.put("frequency_penalty", 0.1);

        try {
            String response = webClient.post()
                .uri("/chat/completions")
                .header("Authorization", "Bearer " + settings.getApiKey())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(settings.getTimeout())
                .block();

            Completion completion = parseCompletion(response);
            log.info("[OPENAI] Completion received | requestId={} | model={} | durationMs={} | tokens={} | finishReason={}",
                request.getId(), model, System.currentTimeMillis() - startTime,
                completion.getTokensUsed(), completion.getFinishReason());
            return completion;

        } catch (WebClientResponseException e) {
            log.error("[OPENAI] HTTP error | requestId={} | model={} | statusCode={} | durationMs={} | error={}",
                request.getId(), model, e.getStatusCode().value(), System.currentTimeMillis() - startTime, e.getMessage());
            throw mapException(e);
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("[OPENAI] Request failed | requestId={} | model={} | durationMs={} | error={}",
                request.getId(), model, System.currentTimeMillis() - startTime, e.getMessage());
            throw transportFailure(e);
        }
    }

    private List<Map<String, String>> buildMessages(LearningRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", EducationalPrompts.buildSystemPrompt(request)));
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
            JsonNode choice = root.path("choices").get(0);
            String text = choice.path("message").path("content").asText("");
            String finishReason = choice.path("finish_reason").asText("");
            int tokens = root.path("usage").path("total_tokens").asInt(0);
            return new Completion(text, mapFinishReason(finishReason), tokens);
        } catch (Exception e) {
            throw malformedResponse(e);
        }
    }

    private FinishReason mapFinishReason(String finishReason) {
        switch (finishReason) {
            case "stop":
                return FinishReason.COMPLETE;
            case "length":
                return FinishReason.TRUNCATED;
            default:
                return FinishReason.OTHER;
        }
    }

    @Override
    public String selectModel(LearningRequest request) {
        QueryType type = request.getQueryType();
        if (type == QueryType.CODE_ASSISTANCE
            || type == QueryType.PROBLEM_SOLVING
            || request.getInputType().carriesImage()) {
            return GPT_4;
        }
        if (request.materialCount() > LARGE_CONTEXT_MATERIALS) {
            return GPT_35_16K;
        }
        return GPT_35;
    }

    @Override
    public ModelCapabilities getCapabilities(String model) {
        String modelName = model != null ? model : getDefaultModel();
        return ModelCapabilities.builder()
            .provider(provider)
            .model(modelName)
            .maxTokens(TOKEN_LIMITS.getOrDefault(modelName, 4096))
            .supportsImages(modelName.contains("vision") || modelName.contains("gpt-4"))
            .supportsAudio(false)
            .supportsCode(true)
            .languages(List.of("en", "es", "fr", "de", "it", "pt", "ru", "ja", "ko", "zh", "ar", "hi"))
            .specialties(List.of(
                QueryType.GENERAL_QUESTION,
                QueryType.HOMEWORK_HELP,
                QueryType.CONCEPT_EXPLANATION,
                QueryType.PROBLEM_SOLVING,
                QueryType.CREATIVE_WRITING,
                QueryType.CODE_ASSISTANCE,
                QueryType.MATH_PROBLEM))
            .costPerToken(COSTS.getOrDefault(modelName, 0.000002))
            .averageResponseTimeMs(2000)
            .build();
    }

    @Override
    public boolean validateCredential() {
        try {
            fetchModels();
            return true;
        } catch (Exception e) {
            log.warn("[OPENAI] Credential validation failed | error={}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> listAvailableModels() {
        try {
            JsonNode models = fetchModels().path("data");
            return StreamSupport.stream(models.spliterator(), false)
                .map(node -> node.path("id").asText())
                .filter(id -> id.contains("gpt"))
                .sorted()
                .toList();
        } catch (Exception e) {
            log.warn("[OPENAI] Model listing failed, using static table | error={}", e.getMessage());
            return List.of(GPT_35, GPT_35_16K, GPT_4);
        }
    }

    private JsonNode fetchModels() throws Exception {
        String response = webClient.get()
            .uri("/models")
            .header("Authorization", "Bearer " + settings.getApiKey())
            .retrieve()
            .bodyToMono(String.class)
            .timeout(settings.getTimeout())
            .block();
        return objectMapper.readTree(response);
    }
}
