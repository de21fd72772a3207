package com.cachebench.common.stats;

import java.util.Arrays;
import java.util.Collection;

/**
 * Linear-interpolation percentile over ranks.
 *
 * <pre>
 *   k = (N − 1) × p / 100
 *   f = floor(k),  c = min(f + 1, N − 1)
 *   f == c → sorted[f]
 *   else   → sorted[f] × (c − k) + sorted[c] × (k − f)
 * </pre>
 *
 * <p>Empty input yields {@code 0}. Pure and stateless.
 */
public final class PercentileCalculator {

    private PercentileCalculator() {}

    /**
     * @param values unsorted samples; not modified
     * @param p      target percentile in [0, 100]
     */
    public static double percentile(Collection<Double> values, double p) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        return percentileOfSorted(sorted, p);
    }

    /**
     * @param sorted samples in ascending order
     * @param p      target percentile in [0, 100]
     */
    public static double percentileOfSorted(double[] sorted, double p) {
        if (p < 0.0 || p > 100.0) {
            throw new IllegalArgumentException("percentile must be in [0, 100], was " + p);
        }
        int n = sorted.length;
        if (n == 0) {
            return 0.0;
        }
        double k = (n - 1) * (p / 100.0);
        int f = (int) Math.floor(k);
        int c = Math.min(f + 1, n - 1);
        if (f == c) {
            return sorted[f];
        }
        return sorted[f] * (c - k) + sorted[c] * (k - f);
    }

    static double[] sortedCopy(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }
}
