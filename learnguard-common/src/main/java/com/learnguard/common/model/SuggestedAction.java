package com.learnguard.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Moderation outcome, declared in increasing strictness: allow &lt; filter &lt; block &lt; escalate.
 * <p>
 * Combining verdicts does not follow declaration order: see {@link #precedence()}.
 */
@Getter
@RequiredArgsConstructor
public enum SuggestedAction {

    ALLOW("allow", 0),
    FILTER("filter", 1),
    BLOCK("block", 3),
    ESCALATE("escalate", 2);

    @JsonValue
    private final String code;

    /** block &gt; escalate &gt; filter &gt; allow when several verdicts are merged. */
    private final int precedence;

    public int precedence() {
        return precedence;
    }

    @JsonCreator
    public static SuggestedAction fromString(String value) {
        for (SuggestedAction action : values()) {
            if (action.code.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown suggested action: " + value);
    }
}
