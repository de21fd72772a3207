package com.cachebench.qa.service;

import java.time.Duration;

/**
 * Cache behaviour switches for {@link CacheAsideAnswerService}.
 *
 * @param enabled     {@code false} runs the no-cache control mode: no reads, no writes
 * @param ttl         expiry of written entries
 * @param singleFlight collapse concurrent misses on the same key into one computation;
 *                     when off, each concurrent miss pays the simulated latency and writes
 *                     the same value
 */
public record CacheAsideSettings(
    boolean enabled,
    Duration ttl,
    boolean singleFlight
) {

    public CacheAsideSettings {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive, was " + ttl);
        }
    }

    /**
     * Reads the {@code EXACT_CACHE} switch: caching is on only for the value {@code "1"}.
     * Anything else, including {@code "true"} or {@code "2"}, selects the control run.
     */
    public static boolean isCacheEnabledFlag(String value) {
        return value != null && "1".equals(value.strip());
    }

    public static CacheAsideSettings disabled() {
        return new CacheAsideSettings(false, Duration.ofHours(1), false);
    }
}
