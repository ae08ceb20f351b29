package com.learnguard.core.moderation;

import lombok.Getter;

/**
 * A checker broke while evaluating. Never leaves the pipeline: it is turned into a
 * failed {@code error} check so the verdict blocks.
 */
@Getter
public class ModerationSystemException extends RuntimeException {

    private final String checkType;

    public ModerationSystemException(String checkType, Throwable cause) {
        super("Safety checker '" + checkType + "' failed: " + cause.getMessage(), cause);
        this.checkType = checkType;
    }
}
