package com.learnguard.llm.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Provider credentials and orchestrator tuning, bound from {@code llm.*}.
 * Keys may come from the environment, e.g. {@code LLM_OPENAI_API_KEY}.
 */
@Configuration
@ConfigurationProperties(prefix = "llm")
@Getter
@Setter
public class LlmProperties {

    private ProviderSettings openai = new ProviderSettings("https://api.openai.com/v1", "gpt-3.5-turbo");
    private ProviderSettings anthropic = new ProviderSettings("https://api.anthropic.com/v1", "claude-3-sonnet-20240229");
    private ProviderSettings gemini = new ProviderSettings("https://generativelanguage.googleapis.com/v1beta", "gemini-1.5-flash");
    private Orchestrator orchestrator = new Orchestrator();
    private Multimodal multimodal = new Multimodal();

    @Getter
    @Setter
    public static class ProviderSettings {
        private String apiKey;
        private String baseUrl;
        private String defaultModel;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxOutputTokens = 2048;
        private double temperature = 0.7;

        public ProviderSettings() {
        }

        public ProviderSettings(String baseUrl, String defaultModel) {
            this.baseUrl = baseUrl;
            this.defaultModel = defaultModel;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Orchestrator {
        private Duration callTimeout = Duration.ofSeconds(45);
        private Duration healthCheckTimeout = Duration.ofSeconds(5);
        private int maxConsecutiveFailures = 5;
        private Duration cooldown = Duration.ofMinutes(2);
        private int youngLearnerAge = 13;
        private int largeContextMaterials = 5;
        private int workerThreads = 8;
    }

    @Getter
    @Setter
    public static class Multimodal {
        private Duration timeout = Duration.ofSeconds(30);
        private long maxImageBytes = 10L * 1024 * 1024;
    }
}
