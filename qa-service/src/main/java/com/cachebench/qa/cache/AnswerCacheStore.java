package com.cachebench.qa.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key-value view of the external answer cache.
 *
 * <p>The store is shared with other service instances and is not owned by this process;
 * every call is an independent, non-transactional operation.
 */
public interface AnswerCacheStore {

    /**
     * @return the cached value, or an empty {@link Mono} when absent or expired
     */
    Mono<String> get(String key);

    /**
     * Stores {@code value} under {@code key}, expiring after {@code ttl}.
     * Implementations may signal errors; callers are expected to absorb them.
     */
    Mono<CacheWriteResult> setex(String key, Duration ttl, String value);
}
