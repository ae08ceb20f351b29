package com.learnguard.llm.provider.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnguard.common.model.CourseContext;
import com.learnguard.common.model.CourseMaterial;
import com.learnguard.common.model.InputType;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.QueryType;
import com.learnguard.llm.config.LlmProperties;
import com.learnguard.llm.provider.AbstractProviderAdapter.Completion;
import com.learnguard.llm.provider.AbstractProviderAdapter.FinishReason;
import com.learnguard.llm.provider.ProviderAdapter.ProviderException;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.junit.jupiter.api.Assertions.*;

class ProviderAdaptersTest {

    private final LlmProperties properties = new LlmProperties();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final OpenAiProviderAdapter openAi = new OpenAiProviderAdapter(properties, WebClient.builder(), objectMapper);
    private final AnthropicProviderAdapter anthropic = new AnthropicProviderAdapter(properties, WebClient.builder(), objectMapper);
    private final GeminiProviderAdapter gemini = new GeminiProviderAdapter(properties, WebClient.builder(), objectMapper);

    private static LearningRequest request(QueryType type) {
        return LearningRequest.builder()
            .id("req-1").userId("u").sessionId("s")
            .query("Explain recursion")
            .queryType(type)
            .build();
    }

    private static LearningRequest withMaterials(LearningRequest request, int count) {
        CourseContext.CourseContextBuilder course = CourseContext.builder().courseId("c");
        for (int i = 0; i < count; i++) {
            course.material(CourseMaterial.builder().id("m" + i).build());
        }
        return request.toBuilder().courseContext(course.build()).build();
    }

    @Test
    void adaptersWithoutKeysAreNotConfigured() {
        assertFalse(openAi.isConfigured());
        properties.getAnthropic().setApiKey("sk-ant");
        assertTrue(anthropic.isConfigured());
    }

    @Test
    void openAiModelTable() {
        assertEquals("gpt-4", openAi.selectModel(request(QueryType.CODE_ASSISTANCE)));
        assertEquals("gpt-4", openAi.selectModel(request(QueryType.PROBLEM_SOLVING)));
        assertEquals("gpt-4", openAi.selectModel(request(QueryType.GENERAL_QUESTION).toBuilder().inputType(InputType.IMAGE).build()));
        assertEquals("gpt-3.5-turbo-16k", openAi.selectModel(withMaterials(request(QueryType.HOMEWORK_HELP), 11)));
        assertEquals("gpt-3.5-turbo", openAi.selectModel(withMaterials(request(QueryType.HOMEWORK_HELP), 10)));
    }

    @Test
    void anthropicModelTable() {
        assertEquals("claude-3-sonnet-20240229", anthropic.selectModel(request(QueryType.CREATIVE_WRITING)));
        assertEquals("claude-3-sonnet-20240229", anthropic.selectModel(request(QueryType.CONCEPT_EXPLANATION)));
        assertEquals("claude-3-haiku-20240307", anthropic.selectModel(request(QueryType.GENERAL_QUESTION)));
        assertEquals("claude-3-sonnet-20240229", anthropic.selectModel(request(QueryType.MATH_PROBLEM)));
    }

    @Test
    void geminiModelTable() {
        assertEquals("gemini-1.5-pro", gemini.selectModel(request(QueryType.MATH_PROBLEM)));
        assertEquals("gemini-1.5-pro", gemini.selectModel(withMaterials(request(QueryType.GENERAL_QUESTION), 12)));
        assertEquals("gemini-1.5-flash", gemini.selectModel(request(QueryType.LANGUAGE_LEARNING)));
    }

    @Test
    void capabilityTables() {
        assertEquals(16384, openAi.getCapabilities("gpt-3.5-turbo-16k").getMaxTokens());
        assertEquals(0.00003, openAi.getCapabilities("gpt-4").getCostPerToken());
        assertTrue(openAi.getCapabilities("gpt-4").isSupportsImages());
        assertFalse(openAi.getCapabilities("gpt-3.5-turbo").isSupportsImages());
        assertEquals(200000, anthropic.getCapabilities("claude-3-haiku-20240307").getMaxTokens());
        assertEquals(0.000001, anthropic.getCapabilities("claude-3-haiku-20240307").getCostPerToken());
        assertEquals("claude-3-sonnet-20240229", anthropic.getCapabilities().getModel());
        assertTrue(anthropic.listAvailableModels().contains("claude-3-opus-20240229"));
    }

    @Test
    void parsesOpenAiChatCompletion() {
        Completion completion = openAi.parseCompletion("""
            {"choices":[{"message":{"role":"assistant","content":"Recursion is a function calling itself."},
              "finish_reason":"length"}],
             "usage":{"total_tokens":57}}
            """);

        assertEquals("Recursion is a function calling itself.", completion.getText());
        assertEquals(FinishReason.TRUNCATED, completion.getFinishReason());
        assertEquals(57, completion.getTokensUsed());
    }

    @Test
    void parsesAnthropicMessageBlocks() {
        Completion completion = anthropic.parseCompletion("""
            {"content":[{"type":"text","text":"Part one. "},{"type":"text","text":"Part two."}],
             "stop_reason":"end_turn",
             "usage":{"input_tokens":20,"output_tokens":15}}
            """);

        assertEquals("Part one. Part two.", completion.getText());
        assertEquals(FinishReason.COMPLETE, completion.getFinishReason());
        assertEquals(35, completion.getTokensUsed());
    }

    @Test
    void parsesGeminiCandidates() {
        Completion completion = gemini.parseCompletion("""
            {"candidates":[{"content":{"parts":[{"text":"Bonjour "},{"text":"means hello."}]},"finishReason":"STOP"}],
             "usageMetadata":{"totalTokenCount":12}}
            """);

        assertEquals("Bonjour means hello.", completion.getText());
        assertEquals(FinishReason.COMPLETE, completion.getFinishReason());
        assertEquals(12, completion.getTokensUsed());
    }

    @Test
    void malformedBodiesAreNonRetryableProviderErrors() {
        ProviderException error = assertThrows(ProviderException.class, () -> gemini.parseCompletion("{\"candidates\":[]}"));

        assertFalse(error.isRetryable());
        assertEquals(500, error.getStatusCode());
    }
}
