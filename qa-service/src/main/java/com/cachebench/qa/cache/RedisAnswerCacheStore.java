package com.cachebench.qa.cache;

import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * {@link AnswerCacheStore} backed by Redis string values ({@code GET} / {@code SET key value EX ttl}).
 */
public class RedisAnswerCacheStore implements AnswerCacheStore {

    private final ReactiveStringRedisTemplate redisTemplate;

    public RedisAnswerCacheStore(ReactiveStringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<CacheWriteResult> setex(String key, Duration ttl, String value) {
        return redisTemplate.opsForValue().set(key, value, ttl)
            .map(stored -> Boolean.TRUE.equals(stored)
                ? CacheWriteResult.written()
                : CacheWriteResult.failed("SET not acknowledged"))
            .defaultIfEmpty(CacheWriteResult.failed("SET returned no reply"));
    }
}
