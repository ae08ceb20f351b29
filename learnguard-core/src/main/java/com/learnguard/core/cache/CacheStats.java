package com.learnguard.core.cache;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {

    long hits;
    long misses;
    /** Percent, two decimals. */
    double hitRate;
    long totalKeys;
    boolean available;
}
