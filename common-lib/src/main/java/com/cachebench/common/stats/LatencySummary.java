package com.cachebench.common.stats;

/**
 * Aggregate of one measurement phase.
 *
 * <p>{@code hitRatePercent} = hits / total × 100; all latency figures are milliseconds.
 * An empty phase is represented by {@link #EMPTY} with every field zero.
 */
public record LatencySummary(
    int total,
    int hits,
    int failures,
    double hitRatePercent,
    double p50Millis,
    double p95Millis,
    double p99Millis,
    double meanMillis
) {

    public static final LatencySummary EMPTY = new LatencySummary(0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0);

    public boolean isEmpty() {
        return total == 0;
    }
}
