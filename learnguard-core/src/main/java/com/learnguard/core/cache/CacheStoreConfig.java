package com.learnguard.core.cache;

import com.learnguard.core.config.CacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Picks the response store from {@code learnguard.cache.store}: Caffeine unless set to {@code redis}.
 */
@Configuration
@Slf4j
public class CacheStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "learnguard.cache.store", havingValue = "redis")
    public CacheStore redisCacheStore(StringRedisTemplate redisTemplate) {
        log.info("[CACHE] Using Redis response store");
        return new RedisCacheStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "learnguard.cache.store", havingValue = "memory", matchIfMissing = true)
    public CacheStore caffeineCacheStore(CacheProperties properties) {
        log.info("[CACHE] Using in-memory response store | maximumSize={}", properties.getMaximumSize());
        return new CaffeineCacheStore(properties.getMaximumSize());
    }
}
