package com.learnguard.core.escalation.rules;

import com.learnguard.common.util.QueryNormalizer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent normalized questions per learner. Two questions are the same when their
 * normalized text matches or their word sets overlap by at least {@link #SIMILARITY_THRESHOLD}.
 */
@Component
public class RepeatedQuestionTracker {

    static final double SIMILARITY_THRESHOLD = 0.6;
    static final int MAX_ENTRIES_PER_USER = 50;

    private final Map<String, Deque<Asked>> byUser = new ConcurrentHashMap<>();

    public void record(String userId, String query, Instant askedAt) {
        if (userId == null) {
            return;
        }
        Deque<Asked> history = byUser.computeIfAbsent(userId, id -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(new Asked(QueryNormalizer.normalize(query), askedAt));
            while (history.size() > MAX_ENTRIES_PER_USER) {
                history.removeFirst();
            }
        }
    }

    /**
     * Questions similar to {@code query} asked within {@code window} before {@code now}, the
     * current one included once it has been recorded.
     */
    public int countSimilar(String userId, String query, Duration window, Instant now) {
        Deque<Asked> history = userId == null ? null : byUser.get(userId);
        if (history == null) {
            return 0;
        }
        String normalized = QueryNormalizer.normalize(query);
        Instant since = now.minus(window);
        int count = 0;
        synchronized (history) {
            for (Asked asked : history) {
                if (asked.askedAt().isBefore(since)) {
                    continue;
                }
                if (asked.normalized().equals(normalized)
                    || QueryNormalizer.similarity(asked.normalized(), normalized) >= SIMILARITY_THRESHOLD) {
                    count++;
                }
            }
        }
        return count;
    }

    public void forget(String userId) {
        byUser.remove(userId);
    }

    private record Asked(String normalized, Instant askedAt) {
    }
}
