package com.learnguard.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Response cache settings, bound from {@code learnguard.cache.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "learnguard.cache")
@Getter
@Setter
public class CacheProperties {

    /** {@code memory} (Caffeine) or {@code redis}. */
    private String store = "memory";
    private Duration baseTtl = Duration.ofHours(1);
    private long maximumSize = 10_000;
    private String keyPrefix = "llm:response:";
    private Conversation conversation = new Conversation();

    /** Server-side conversation history, kept per user and session. */
    @Getter
    @Setter
    public static class Conversation {
        private String keyPrefix = "conversation:";
        private int maxHistory = 20;
        private Duration ttl = Duration.ofHours(24);
    }
}
