package com.cachebench.qa.cache;

/**
 * Outcome of a best-effort cache write.
 *
 * <p>A failed write is reported as a value, not an error signal: the request that
 * triggered it has already computed its answer and must be answered regardless.
 */
public record CacheWriteResult(
    Status status,
    String reason
) {

    public enum Status { WRITTEN, FAILED }

    private static final CacheWriteResult WRITTEN = new CacheWriteResult(Status.WRITTEN, null);

    public static CacheWriteResult written() {
        return WRITTEN;
    }

    public static CacheWriteResult failed(String reason) {
        return new CacheWriteResult(Status.FAILED, reason);
    }

    public static CacheWriteResult failed(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return failed(message);
    }

    public boolean isWritten() {
        return status == Status.WRITTEN;
    }
}
