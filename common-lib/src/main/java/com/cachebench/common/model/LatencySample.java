package com.cachebench.common.model;

/**
 * Round-trip observation for a single benchmark request.
 *
 * <p>Failed requests are still recorded with their elapsed wall-clock time and
 * {@code cacheHit=false}, so that failures inflate the percentiles instead of vanishing.
 */
public record LatencySample(
    double elapsedMillis,
    boolean cacheHit,
    boolean failed
) {

    public static LatencySample success(double elapsedMillis, boolean cacheHit) {
        return new LatencySample(elapsedMillis, cacheHit, false);
    }

    public static LatencySample failure(double elapsedMillis) {
        return new LatencySample(elapsedMillis, false, true);
    }
}
