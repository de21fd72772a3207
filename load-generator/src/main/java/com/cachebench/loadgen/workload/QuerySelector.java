package com.cachebench.loadgen.workload;

import com.cachebench.loadgen.exception.BenchmarkConfigurationException;

import java.util.List;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Picks the next query of the synthetic workload.
 *
 * <p>With probability {@code repeatRatio} the query is drawn uniformly from the
 * <em>popular</em> subset (the first {@value #POPULAR_POOL_SIZE} queries of the pool, at least
 * one); otherwise uniformly from the whole pool. A high ratio therefore produces a
 * repetitive, cache-friendly workload.
 *
 * <p>Not thread-safe; the load generator calls it from its single pacing loop.
 */
public class QuerySelector {

    static final int POPULAR_POOL_SIZE = 20;

    private final List<String> allQueries;
    private final List<String> popularQueries;
    private final double repeatRatio;
    private final RandomGenerator random;

    public QuerySelector(List<String> pool, double repeatRatio) {
        this(pool, repeatRatio, new SplittableRandom());
    }

    public QuerySelector(List<String> pool, double repeatRatio, RandomGenerator random) {
        if (pool == null || pool.isEmpty()) {
            throw new BenchmarkConfigurationException("query pool must not be empty");
        }
        this.allQueries     = List.copyOf(pool);
        this.popularQueries = allQueries.subList(0, Math.max(1, Math.min(POPULAR_POOL_SIZE, allQueries.size())));
        this.repeatRatio    = repeatRatio;
        this.random         = random;
    }

    public String next() {
        List<String> source = random.nextDouble() < repeatRatio ? popularQueries : allQueries;
        return source.get(random.nextInt(source.size()));
    }

    public List<String> popularQueries() {
        return popularQueries;
    }
}
