package com.cachebench.common.stats;

import com.cachebench.common.model.LatencySample;

import java.util.List;

/**
 * Reduces a run's {@link LatencySample}s to a {@link LatencySummary}.
 * Failed samples count toward the percentiles and the total but never as hits.
 */
public final class LatencyStatistics {

    private LatencyStatistics() {}

    public static LatencySummary summarize(List<LatencySample> samples) {
        if (samples == null || samples.isEmpty()) {
            return LatencySummary.EMPTY;
        }

        int total    = samples.size();
        int hits     = 0;
        int failures = 0;
        double sum   = 0.0;
        double[] elapsed = new double[total];

        for (int i = 0; i < total; i++) {
            LatencySample sample = samples.get(i);
            elapsed[i] = sample.elapsedMillis();
            sum += sample.elapsedMillis();
            if (sample.cacheHit()) hits++;
            if (sample.failed())   failures++;
        }

        double[] sorted = PercentileCalculator.sortedCopy(elapsed);
        return new LatencySummary(
            total,
            hits,
            failures,
            hits * 100.0 / total,
            PercentileCalculator.percentileOfSorted(sorted, 50),
            PercentileCalculator.percentileOfSorted(sorted, 95),
            PercentileCalculator.percentileOfSorted(sorted, 99),
            sum / total
        );
    }
}
