package com.learnguard.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Supported LLM backends, declared in registration order.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {

    OPENAI(
        "OpenAI",
        "openai",
        0,      // no guardrail preference
        5       // 16k models for large course contexts
    ),

    ANTHROPIC(
        "Anthropic",
        "anthropic",
        5,      // stronger built-in guardrails for young learners
        8       // 200k context window
    ),

    GEMINI(
        "Gemini",
        "gemini",
        0,
        6
    );

    private final String displayName;
    private final String code;
    private final int youngLearnerBonus;
    private final int largeContextBonus;

    public static LlmProvider fromString(String name) {
        for (LlmProvider provider : values()) {
            if (provider.name().equalsIgnoreCase(name) ||
                provider.getCode().equalsIgnoreCase(name) ||
                provider.getDisplayName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + name);
    }
}
