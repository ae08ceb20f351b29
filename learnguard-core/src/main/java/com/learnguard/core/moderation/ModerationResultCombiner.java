package com.learnguard.core.moderation;

import com.learnguard.common.model.ModerationResult;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges independent verdicts into one.
 * <ul>
 *   <li>severity: the most severe of all results</li>
 *   <li>action: block &gt; escalate &gt; filter &gt; allow, whatever the confidences</li>
 *   <li>categories: union, most severe first</li>
 *   <li>confidence: minimum over all results when the outcome is allow, otherwise the
 *       confidence of the most severe non-allow result</li>
 * </ul>
 */
@Component
public class ModerationResultCombiner {

    static final double EMPTY_CONFIDENCE = 0.5;

    private static final Comparator<ModerationResult> BY_SEVERITY_DESC =
        Comparator.comparing(ModerationResultCombiner::severityOf).reversed();

    public ModerationResult combine(List<ModerationResult> results) {
        if (results == null || results.isEmpty()) {
            return ModerationResult.allowAll(EMPTY_CONFIDENCE);
        }

        SuggestedAction action = results.stream()
            .map(ModerationResultCombiner::actionOf)
            .max(Comparator.comparingInt(SuggestedAction::precedence))
            .orElse(SuggestedAction.ALLOW);

        SafetyLevel severity = results.stream()
            .map(ModerationResultCombiner::severityOf)
            .reduce(SafetyLevel.LOW, SafetyLevel::max);

        // stable sort keeps checker order among equal severities
        List<ModerationResult> bySeverity = results.stream().sorted(BY_SEVERITY_DESC).toList();
        Set<String> categories = new LinkedHashSet<>();
        bySeverity.forEach(result -> categories.addAll(result.getCategories()));

        double confidence;
        if (action == SuggestedAction.ALLOW) {
            confidence = results.stream().mapToDouble(ModerationResult::getConfidence).min().orElse(EMPTY_CONFIDENCE);
        } else {
            confidence = bySeverity.stream()
                .filter(result -> actionOf(result) != SuggestedAction.ALLOW)
                .findFirst()
                .map(ModerationResult::getConfidence)
                .orElse(EMPTY_CONFIDENCE);
        }

        String reason = results.stream()
            .filter(result -> actionOf(result) != SuggestedAction.ALLOW)
            .map(ModerationResult::getReason)
            .filter(Objects::nonNull)
            .collect(Collectors.joining("; "));

        return ModerationResult.builder()
            .appropriate(action == SuggestedAction.ALLOW)
            .confidence(confidence)
            .categories(categories)
            .severity(severity)
            .suggestedAction(action)
            .reason(reason.isEmpty() ? null : reason)
            .checks(results.stream().flatMap(result -> result.getChecks().stream()).toList())
            .build();
    }

    private static SafetyLevel severityOf(ModerationResult result) {
        return result.getSeverity() == null ? SafetyLevel.LOW : result.getSeverity();
    }

    private static SuggestedAction actionOf(ModerationResult result) {
        return result.getSuggestedAction() == null ? SuggestedAction.ALLOW : result.getSuggestedAction();
    }
}
