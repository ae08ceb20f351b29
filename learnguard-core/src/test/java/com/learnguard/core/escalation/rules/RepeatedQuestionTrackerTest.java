package com.learnguard.core.escalation.rules;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RepeatedQuestionTrackerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration WINDOW = Duration.ofMinutes(30);

    private final RepeatedQuestionTracker tracker = new RepeatedQuestionTracker();

    @Test
    void countsSimilarQuestionsInsideWindow() {
        tracker.record("u1", "What is a fraction?", T0);
        tracker.record("u1", "what is a fraction", T0.plusSeconds(300));
        tracker.record("u1", "Who wrote Hamlet?", T0.plusSeconds(400));

        assertEquals(2, tracker.countSimilar("u1", "What is a FRACTION", WINDOW, T0.plusSeconds(600)));
    }

    @Test
    void oldQuestionsFallOutOfTheWindow() {
        tracker.record("u1", "What is a fraction?", T0);
        tracker.record("u1", "What is a fraction?", T0.plus(Duration.ofMinutes(45)));

        assertEquals(1, tracker.countSimilar("u1", "What is a fraction?", WINDOW, T0.plus(Duration.ofMinutes(50))));
    }

    @Test
    void learnersAreTrackedSeparately() {
        tracker.record("u1", "What is a fraction?", T0);

        assertEquals(0, tracker.countSimilar("u2", "What is a fraction?", WINDOW, T0));
    }

    @Test
    void historyIsBounded() {
        for (int i = 0; i < RepeatedQuestionTracker.MAX_ENTRIES_PER_USER + 10; i++) {
            tracker.record("u1", "same question", T0);
        }

        assertEquals(RepeatedQuestionTracker.MAX_ENTRIES_PER_USER, tracker.countSimilar("u1", "same question", WINDOW, T0));
    }
}
