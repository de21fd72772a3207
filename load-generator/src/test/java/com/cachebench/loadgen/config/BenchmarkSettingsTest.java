package com.cachebench.loadgen.config;

import com.cachebench.loadgen.exception.BenchmarkConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkSettingsTest {

    private static BenchmarkSettings withRatio(double repeatRatio) {
        return new BenchmarkSettings("http://127.0.0.1:8088", 5, Duration.ofSeconds(120), Duration.ofSeconds(10),
            "data/bench_queries.txt", repeatRatio, BenchmarkSettings.DEFAULT_REQUEST_TIMEOUT, 900.0);
    }

    @Test
    @DisplayName("repeat ratio bounds 0 and 1 are accepted")
    void ratioBounds() {
        assertDoesNotThrow(() -> withRatio(0.0));
        assertDoesNotThrow(() -> withRatio(1.0));
    }

    @Test
    @DisplayName("repeat ratio outside [0, 1] is a configuration error")
    void ratioOutOfRange() {
        assertThrows(BenchmarkConfigurationException.class, () -> withRatio(1.5));
        assertThrows(BenchmarkConfigurationException.class, () -> withRatio(-0.1));
        assertThrows(BenchmarkConfigurationException.class, () -> withRatio(Double.NaN));
    }

    @Test
    @DisplayName("blank host is a configuration error")
    void blankHost() {
        assertThrows(BenchmarkConfigurationException.class, () -> new BenchmarkSettings(" ", 5,
            Duration.ofSeconds(1), Duration.ZERO, "q.txt", 0.7, Duration.ofSeconds(30), 900.0));
    }
}
