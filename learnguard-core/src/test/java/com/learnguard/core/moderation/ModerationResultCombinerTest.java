package com.learnguard.core.moderation;

import com.learnguard.common.model.ModerationResult;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ModerationResultCombinerTest {

    private final ModerationResultCombiner combiner = new ModerationResultCombiner();

    private static ModerationResult verdict(String category, SafetyLevel severity, SuggestedAction action, double confidence) {
        ModerationResult.ModerationResultBuilder builder = ModerationResult.builder()
            .appropriate(action == SuggestedAction.ALLOW)
            .confidence(confidence)
            .severity(severity)
            .suggestedAction(action)
            .reason(category);
        if (category != null) {
            builder.category(category);
        }
        return builder.build();
    }

    @Test
    void blockWinsRegardlessOfOrderAndConfidence() {
        List<ModerationResult> results = new ArrayList<>(List.of(
            verdict(null, SafetyLevel.LOW, SuggestedAction.ALLOW, 0.99),
            verdict("bias", SafetyLevel.LOW, SuggestedAction.FILTER, 0.99),
            verdict("distress", SafetyLevel.CRITICAL, SuggestedAction.ESCALATE, 0.99),
            verdict("personal_information", SafetyLevel.MEDIUM, SuggestedAction.BLOCK, 0.01)
        ));
        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(results, random);
            ModerationResult combined = combiner.combine(results);
            assertEquals(SuggestedAction.BLOCK, combined.getSuggestedAction());
            assertFalse(combined.isAppropriate());
            assertEquals(SafetyLevel.CRITICAL, combined.getSeverity());
        }
    }

    @Test
    void escalateBeatsFilter() {
        ModerationResult combined = combiner.combine(List.of(
            verdict("bias", SafetyLevel.LOW, SuggestedAction.FILTER, 0.7),
            verdict("distress", SafetyLevel.HIGH, SuggestedAction.ESCALATE, 0.8)
        ));

        assertEquals(SuggestedAction.ESCALATE, combined.getSuggestedAction());
        assertEquals(0.8, combined.getConfidence());
    }

    @Test
    void allowBranchUsesMinimumConfidence() {
        ModerationResult combined = combiner.combine(List.of(
            verdict(null, SafetyLevel.LOW, SuggestedAction.ALLOW, 0.9),
            verdict(null, SafetyLevel.LOW, SuggestedAction.ALLOW, 0.2),
            verdict(null, SafetyLevel.LOW, SuggestedAction.ALLOW, 0.6)
        ));

        assertTrue(combined.isAppropriate());
        assertEquals(SuggestedAction.ALLOW, combined.getSuggestedAction());
        assertEquals(0.2, combined.getConfidence());
    }

    @Test
    void categoriesAreUnionedMostSevereFirst() {
        ModerationResult combined = combiner.combine(List.of(
            verdict("profanity", SafetyLevel.MEDIUM, SuggestedAction.FILTER, 0.9),
            verdict(null, SafetyLevel.LOW, SuggestedAction.ALLOW, 0.1),
            verdict("inappropriate_topic", SafetyLevel.HIGH, SuggestedAction.BLOCK, 0.9),
            verdict("academic_integrity", SafetyLevel.MEDIUM, SuggestedAction.FILTER, 0.8)
        ));

        assertEquals(List.of("inappropriate_topic", "profanity", "academic_integrity"),
            new ArrayList<>(combined.getCategories()));
        assertEquals("inappropriate_topic", combined.primaryCategory());
    }

    @Test
    void emptyInputAllows() {
        ModerationResult combined = combiner.combine(List.of());

        assertTrue(combined.isAppropriate());
        assertEquals(ModerationResultCombiner.EMPTY_CONFIDENCE, combined.getConfidence());
    }
}
