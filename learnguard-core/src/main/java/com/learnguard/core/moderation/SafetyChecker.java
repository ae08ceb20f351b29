package com.learnguard.core.moderation;

import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;

import java.util.Set;

/**
 * One independent policy check. Implementations hold no mutable state and may run
 * concurrently for different requests; a keyword heuristic and an ML classifier are
 * interchangeable behind this interface.
 */
public interface SafetyChecker {

    /**
     * Check type, also used as the moderation category when the check fails.
     */
    String type();

    Set<ModerationStage> stages();

    SafetyCheck evaluate(String text, CheckContext context);

    /**
     * Severity reported when {@link #evaluate} fails.
     */
    SafetyLevel failureSeverity();

    SuggestedAction failureAction();

    /**
     * Whether the check has anything to say for this context (e.g. no learner age known).
     */
    default boolean appliesTo(CheckContext context) {
        return true;
    }
}
