package com.cachebench.loadgen.exception;

import com.cachebench.common.exception.CacheBenchException;

/**
 * Fatal setup problem detected before any traffic is sent (unreadable or empty query
 * file, out-of-range settings).
 */
public class BenchmarkConfigurationException extends CacheBenchException {

    public BenchmarkConfigurationException(String message) {
        super("LoadGenerator", message);
    }

    public BenchmarkConfigurationException(String message, Throwable cause) {
        super("LoadGenerator", message, cause);
    }
}
