package com.learnguard.core.cache;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

public class RedisCacheStore implements CacheStore {

    private final StringRedisTemplate redis;

    public RedisCacheStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("get", e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redis.opsForValue().set(key, value, ttl);
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("set", e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redis.delete(key));
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("delete", e);
        }
    }

    @Override
    public long deleteByPattern(String pattern) {
        try {
            Set<String> keys = redis.keys(pattern);
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = redis.delete(keys);
            return deleted == null ? 0 : deleted;
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("deleteByPattern", e);
        }
    }

    @Override
    public long increment(String key) {
        try {
            Long value = redis.opsForValue().increment(key);
            return value == null ? 0 : value;
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("increment", e);
        }
    }

    @Override
    public long countKeys(String pattern) {
        try {
            Set<String> keys = redis.keys(pattern);
            return keys == null ? 0 : keys.size();
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("countKeys", e);
        }
    }
}
