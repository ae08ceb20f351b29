package com.learnguard.llm.router;

/**
 * No adapter is registered. A configuration problem; never retried.
 */
public class NoProviderAvailableException extends RuntimeException {

    public NoProviderAvailableException(String message) {
        super(message);
    }
}
