package com.learnguard.core.moderation.checks;

import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.core.moderation.ModerationStage;
import com.learnguard.core.moderation.SafetyChecker;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Holds the fixed verdict of a checker.
 */
public abstract class BaseSafetyChecker implements SafetyChecker {

    private final String type;
    private final Set<ModerationStage> stages;
    private final SafetyLevel failureSeverity;
    private final SuggestedAction failureAction;

    protected BaseSafetyChecker(String type, SafetyLevel failureSeverity, SuggestedAction failureAction,
                                ModerationStage first, ModerationStage... rest) {
        this.type = type;
        this.stages = EnumSet.of(first, rest);
        this.failureSeverity = failureSeverity;
        this.failureAction = failureAction;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public Set<ModerationStage> stages() {
        return stages;
    }

    @Override
    public SafetyLevel failureSeverity() {
        return failureSeverity;
    }

    @Override
    public SuggestedAction failureAction() {
        return failureAction;
    }

    protected static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
