package com.learnguard.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * In-process store with a TTL per entry.
 */
public class CaffeineCacheStore implements CacheStore {

    private final Cache<String, Entry> cache;

    public CaffeineCacheStore(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    CaffeineCacheStore(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntryExpiry())
            .ticker(ticker)
            .executor(Runnable::run)
            .build();
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl.toNanos()));
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public long deleteByPattern(String pattern) {
        List<String> keys = matching(pattern);
        cache.invalidateAll(keys);
        return keys.size();
    }

    @Override
    public long increment(String key) {
        Entry updated = cache.asMap().compute(key, (k, current) -> {
            long next = current == null ? 1 : Long.parseLong(current.value()) + 1;
            return new Entry(Long.toString(next), Long.MAX_VALUE);
        });
        return Long.parseLong(updated.value());
    }

    @Override
    public long countKeys(String pattern) {
        return matching(pattern).size();
    }

    private List<String> matching(String pattern) {
        Pattern regex = globToRegex(pattern);
        return cache.asMap().keySet().stream()
            .filter(key -> regex.matcher(key).matches())
            .toList();
    }

    /** {@code *} matches any run of characters; a backslash makes the next character literal. */
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                literal.append(glob.charAt(++i));
            } else if (c == '*') {
                regex.append(Pattern.quote(literal.toString())).append(".*");
                literal.setLength(0);
            } else {
                literal.append(c);
            }
        }
        regex.append(Pattern.quote(literal.toString()));
        return Pattern.compile(regex.toString());
    }

    private record Entry(String value, long ttlNanos) {
    }

    private static class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
