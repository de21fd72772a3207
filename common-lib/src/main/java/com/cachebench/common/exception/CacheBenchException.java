package com.cachebench.common.exception;

/**
 * Base for startup failures. The message is prefixed with the component that raised it;
 * {@link #getReason()} returns the bare text for structured log lines.
 */
public class CacheBenchException extends RuntimeException {
    private final String component;
    private final String reason;

    public CacheBenchException(String component, String reason) {
        this(component, reason, null);
    }

    public CacheBenchException(String component, String reason, Throwable cause) {
        super("[" + component + "] " + reason, cause);
        this.component = component;
        this.reason    = reason;
    }

    public String getComponent() {
        return component;
    }

    public String getReason() {
        return reason;
    }
}
