package com.cachebench.common.latency;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Cost model of the uncached path: {@code base + uniform[0, jitter]} milliseconds.
 *
 * <p>This class only computes the delay. Callers must wait for it without holding a
 * thread (e.g. {@code Mono.delay}), so a slow miss never stalls other requests.
 */
public class LatencySimulator {

    private final long baseMillis;
    private final long jitterMillis;
    private final RandomGenerator random;   // null → ThreadLocalRandom of the calling thread

    public LatencySimulator(long baseMillis, long jitterMillis) {
        this(baseMillis, jitterMillis, null);
    }

    /**
     * @param random fixed random source for reproducible tests; {@code null} uses
     *               {@link ThreadLocalRandom}
     */
    public LatencySimulator(long baseMillis, long jitterMillis, RandomGenerator random) {
        if (baseMillis < 0) {
            throw new IllegalArgumentException("baseMillis must be >= 0, was " + baseMillis);
        }
        if (jitterMillis < 0) {
            throw new IllegalArgumentException("jitterMillis must be >= 0, was " + jitterMillis);
        }
        this.baseMillis   = baseMillis;
        this.jitterMillis = jitterMillis;
        this.random       = random;
    }

    /** Next simulated delay; the jitter bound is inclusive. */
    public Duration delay() {
        if (jitterMillis == 0) {
            return Duration.ofMillis(baseMillis);
        }
        RandomGenerator source = random != null ? random : ThreadLocalRandom.current();
        return Duration.ofMillis(baseMillis + source.nextLong(0, jitterMillis + 1));
    }

    public long baseMillis() {
        return baseMillis;
    }

    public long jitterMillis() {
        return jitterMillis;
    }
}
