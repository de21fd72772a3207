package com.cachebench.loadgen.report;

import com.cachebench.common.stats.LatencySummary;

/**
 * Outcome of a load run: measured statistics plus the verdict against the p95 target.
 */
public record BenchmarkReport(
    LatencySummary summary,
    double targetP95Millis
) {

    /** {@code true} when p95 is strictly below the target. An empty run never passes. */
    public boolean passed() {
        return !summary.isEmpty() && summary.p95Millis() < targetP95Millis;
    }
}
