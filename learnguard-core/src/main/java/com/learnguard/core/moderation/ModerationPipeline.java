package com.learnguard.core.moderation;

import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.ModerationResult;
import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.core.config.SafetyProperties;
import com.learnguard.core.moderation.checks.AgeAppropriatenessChecker;
import com.learnguard.core.moderation.checks.InappropriateTopicChecker;
import com.learnguard.core.moderation.checks.ProfanityChecker;
import com.learnguard.core.moderation.checks.ResponseContentChecker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs every enabled checker for a stage and merges the verdicts.
 * A checker that throws contributes a failed {@code error} check, so an outage blocks.
 */
@Service
@Slf4j
public class ModerationPipeline {

    private final List<SafetyChecker> checkers;
    private final ModerationResultCombiner combiner;
    private final Map<String, Boolean> enabled = new ConcurrentHashMap<>();

    public ModerationPipeline(List<SafetyChecker> checkers, SafetyProperties properties, ModerationResultCombiner combiner) {
        this.checkers = List.copyOf(checkers);
        this.combiner = combiner;
        for (SafetyChecker checker : this.checkers) {
            enabled.put(checker.type(), initiallyEnabled(checker.type(), properties));
        }
        log.info("[MODERATION] Pipeline ready | checkers={} | enabled={}", checkers.size(),
            enabled.values().stream().filter(Boolean::booleanValue).count());
    }

    public ModerationResult moderateInput(LearningRequest request) {
        return run(request.getQuery(), CheckContext.forInput(request));
    }

    public ModerationResult moderateOutput(LearningResponse response, LearningRequest request) {
        return run(response.getText(), CheckContext.forOutput(request, response));
    }

    /**
     * Enable or disable checkers by type at runtime. Unknown types are ignored.
     */
    public void updateCheckers(Map<String, Boolean> changes) {
        changes.forEach((type, on) -> {
            if (enabled.containsKey(type) && on != null) {
                enabled.put(type, on);
                log.info("[MODERATION] Checker updated | type={} | enabled={}", type, on);
            } else {
                log.warn("[MODERATION] Ignoring update for unknown checker | type={}", type);
            }
        });
    }

    public Map<String, Object> getCheckerConfiguration() {
        Map<String, Object> configuration = new LinkedHashMap<>();
        for (SafetyChecker checker : checkers) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("enabled", enabled.get(checker.type()));
            entry.put("stages", checker.stages());
            entry.put("failureSeverity", checker.failureSeverity().getCode());
            entry.put("failureAction", checker.failureAction().getCode());
            configuration.put(checker.type(), entry);
        }
        return configuration;
    }

    private ModerationResult run(String text, CheckContext context) {
        long startTime = System.currentTimeMillis();
        List<ModerationResult> results = new ArrayList<>();

        for (SafetyChecker checker : checkers) {
            if (isActive(checker, context)) {
                results.add(evaluate(checker, text, context));
            }
        }

        ModerationResult combined = combiner.combine(results);
        log.debug("[MODERATION] Stage complete | stage={} | requestId={} | checks={} | action={} | severity={} | durationMs={}",
            context.getStage(), requestId(context), results.size(), combined.getSuggestedAction(),
            combined.getSeverity(), System.currentTimeMillis() - startTime);
        if (!combined.isAppropriate()) {
            log.info("[MODERATION] Content flagged | stage={} | requestId={} | categories={} | action={}",
                context.getStage(), requestId(context), combined.getCategories(), combined.getSuggestedAction());
        }
        return combined;
    }

    private ModerationResult evaluate(SafetyChecker checker, String text, CheckContext context) {
        try {
            SafetyCheck check = checker.evaluate(text, context);
            return toResult(check, checker.failureSeverity(), checker.failureAction());
        } catch (RuntimeException e) {
            ModerationSystemException failure = new ModerationSystemException(checker.type(), e);
            log.error("[MODERATION] Checker failed, blocking | type={} | requestId={} | error={}",
                checker.type(), requestId(context), e.getMessage(), failure);
            return toResult(SafetyCheck.systemError(failure.getMessage()), SafetyLevel.HIGH, SuggestedAction.BLOCK);
        }
    }

    static ModerationResult toResult(SafetyCheck check, SafetyLevel failureSeverity, SuggestedAction failureAction) {
        if (check.isPassed()) {
            return ModerationResult.builder()
                .appropriate(true)
                .confidence(check.getConfidence())
                .severity(SafetyLevel.LOW)
                .suggestedAction(SuggestedAction.ALLOW)
                .check(check)
                .build();
        }
        return ModerationResult.builder()
            .appropriate(false)
            .confidence(check.getConfidence())
            .category(check.getType())
            .severity(failureSeverity)
            .suggestedAction(failureAction)
            .reason(check.getDetails())
            .check(check)
            .build();
    }

    private boolean isActive(SafetyChecker checker, CheckContext context) {
        return Boolean.TRUE.equals(enabled.get(checker.type()))
            && checker.stages().contains(context.getStage())
            && checker.appliesTo(context);
    }

    private static boolean initiallyEnabled(String type, SafetyProperties properties) {
        return switch (type) {
            case ProfanityChecker.TYPE -> properties.isProfanityFilterEnabled();
            case InappropriateTopicChecker.TYPE, ResponseContentChecker.TYPE -> properties.isContentFilterEnabled();
            case AgeAppropriatenessChecker.TYPE -> properties.isAgeVerificationRequired();
            default -> true;
        };
    }

    private static String requestId(CheckContext context) {
        return context.getRequest() == null ? null : context.getRequest().getId();
    }
}
