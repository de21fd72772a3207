package com.cachebench.loadgen.config;

import com.cachebench.loadgen.exception.BenchmarkConfigurationException;

import java.time.Duration;

/**
 * Parameters of one load run.
 *
 * @param host            base URL of the QA service, e.g. {@code http://127.0.0.1:8088}
 * @param rps             target dispatch rate; values below {@link #MIN_RPS} are raised to it
 * @param duration        measured phase length
 * @param warmup          unmeasured phase length preceding the measurement
 * @param queriesFile     newline-delimited query list
 * @param repeatRatio     probability in [0, 1] of drawing from the popular subset
 * @param requestTimeout  per-request upper bound; exceeding it records a failed sample
 * @param targetP95Millis pass/fail threshold for p95
 */
public record BenchmarkSettings(
    String host,
    double rps,
    Duration duration,
    Duration warmup,
    String queriesFile,
    double repeatRatio,
    Duration requestTimeout,
    double targetP95Millis
) {

    public static final double MIN_RPS = 0.1;
    public static final double DEFAULT_TARGET_P95_MILLIS = 900.0;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public BenchmarkSettings {
        if (host == null || host.isBlank()) {
            throw new BenchmarkConfigurationException("host must not be blank");
        }
        if (Double.isNaN(rps)) {
            throw new BenchmarkConfigurationException("rps must be a number");
        }
        if (Double.isNaN(repeatRatio) || repeatRatio < 0.0 || repeatRatio > 1.0) {
            throw new BenchmarkConfigurationException("repeat-ratio must be within [0, 1], was " + repeatRatio);
        }
        if (duration.isNegative() || warmup.isNegative()) {
            throw new BenchmarkConfigurationException("duration and warmup must be >= 0");
        }
    }

    /** Pause between dispatches: {@code 1 / max(rps, 0.1)} seconds. */
    public Duration dispatchInterval() {
        double effectiveRps = Math.max(rps, MIN_RPS);
        return Duration.ofNanos(Math.round(1_000_000_000.0 / effectiveRps));
    }
}
