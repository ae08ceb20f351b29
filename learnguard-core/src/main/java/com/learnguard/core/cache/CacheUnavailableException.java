package com.learnguard.core.cache;

/**
 * The backing store could not be reached. Caught inside {@link ResponseCache}: reads
 * become misses and writes become no-ops.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String operation, Throwable cause) {
        super("Cache store unavailable during " + operation + ": " + cause.getMessage(), cause);
    }
}
