package com.learnguard.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value string store behind the response cache. Patterns are globs where {@code *}
 * matches any run of characters and a backslash escapes the next character.
 * Implementations signal an unreachable backend with {@link CacheUnavailableException}.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    long deleteByPattern(String pattern);

    /** Atomically adds one to a counter, creating it at zero. Counters never expire. */
    long increment(String key);

    long countKeys(String pattern);
}
