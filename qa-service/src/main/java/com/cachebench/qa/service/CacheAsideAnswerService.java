package com.cachebench.qa.service;

import com.cachebench.common.knowledge.KnowledgeBase;
import com.cachebench.common.latency.LatencySimulator;
import com.cachebench.common.matching.FallbackMatcher;
import com.cachebench.common.model.AnswerResult;
import com.cachebench.common.text.KeyNormalizer;
import com.cachebench.qa.cache.AnswerCacheStore;
import com.cachebench.qa.cache.CacheWriteResult;
import com.cachebench.qa.dto.AskResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache-aside request handling for POST /ask.
 *
 * <p><strong>Flow per request:</strong>
 * <pre>
 *   Start → CacheCheck ─ HIT  → Respond (from_cache=true, match=cache)
 *                      └ MISS → Simulate → Match → CacheWrite → Respond (from_cache=false)
 * </pre>
 *
 * <ul>
 *   <li>Cache key is {@code "qa:" + normalize(query)}.</li>
 *   <li>A cache read error is treated exactly like a miss.</li>
 *   <li>A cache write failure is logged and dropped; the freshly computed answer is still returned.</li>
 *   <li>At most one read and one write per request, no retries.</li>
 *   <li>With caching disabled neither the read nor the write happens.</li>
 * </ul>
 *
 * <p>The simulated latency is awaited with {@code Mono.delay}, which releases the event-loop
 * thread; concurrent requests keep flowing while a miss is "processing".
 *
 * <p>Concurrent misses for the same key are not de-duplicated unless
 * {@link CacheAsideSettings#singleFlight()} is set. Without it each miss computes and
 * writes independently (last write wins; values are identical so this is safe).
 */
public class CacheAsideAnswerService {

    private static final Logger log = LoggerFactory.getLogger(CacheAsideAnswerService.class);

    public static final String CACHE_KEY_PREFIX = "qa:";

    private final AnswerCacheStore cacheStore;
    private final KnowledgeBase knowledgeBase;
    private final LatencySimulator latencySimulator;
    private final CacheAsideSettings settings;

    private final ConcurrentHashMap<String, Mono<AnswerResult>> inFlight = new ConcurrentHashMap<>();

    public CacheAsideAnswerService(AnswerCacheStore cacheStore,
                                   KnowledgeBase knowledgeBase,
                                   LatencySimulator latencySimulator,
                                   CacheAsideSettings settings) {
        this.cacheStore       = cacheStore;
        this.knowledgeBase    = knowledgeBase;
        this.latencySimulator = latencySimulator;
        this.settings         = settings;
    }

    public static String cacheKey(String rawQuery) {
        return CACHE_KEY_PREFIX + KeyNormalizer.normalize(rawQuery);
    }

    public Mono<AskResponse> handle(String rawQuery) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            String cacheKey = cacheKey(rawQuery);

            Mono<AskResponse> computed = Mono.defer(() -> computeOnMiss(rawQuery, cacheKey))
                .map(result -> toResponse(rawQuery, cacheKey, result, false, startNanos));

            if (!settings.enabled()) {
                return computed;
            }

            return readCache(cacheKey)
                .map(cached -> {
                    AskResponse response = toResponse(rawQuery, cacheKey, AnswerResult.cached(cached), true, startNanos);
                    log.info("CACHE_HIT key={} latencyMs={}", cacheKey, response.latencyMs());
                    return response;
                })
                .switchIfEmpty(computed);
        });
    }

    // ── cache read (fail-open) ────────────────────────────────────────────────

    private Mono<String> readCache(String cacheKey) {
        return cacheStore.get(cacheKey)
            .onErrorResume(e -> {
                log.warn("CACHE_READ_FAILED key={} treating as miss. reason={}", cacheKey, e.getMessage());
                return Mono.empty();
            });
    }

    // ── miss path ─────────────────────────────────────────────────────────────

    private Mono<AnswerResult> computeOnMiss(String rawQuery, String cacheKey) {
        if (settings.enabled() && settings.singleFlight()) {
            return inFlight.computeIfAbsent(cacheKey, key ->
                simulateMatchAndStore(rawQuery, key)
                    .doFinally(signal -> inFlight.remove(key))
                    .cache());
        }
        return simulateMatchAndStore(rawQuery, cacheKey);
    }

    private Mono<AnswerResult> simulateMatchAndStore(String rawQuery, String cacheKey) {
        Duration delay = latencySimulator.delay();
        log.info("CACHE_MISS key={} simulatedDelayMs={} cacheEnabled={}",
                 cacheKey, delay.toMillis(), settings.enabled());

        return Mono.delay(delay)
            .map(tick -> FallbackMatcher.match(rawQuery, knowledgeBase))
            .flatMap(result -> writeBack(cacheKey, result.answerText()).thenReturn(result));
    }

    // ── cache write (best-effort) ─────────────────────────────────────────────

    private Mono<CacheWriteResult> writeBack(String cacheKey, String answerText) {
        if (!settings.enabled()) {
            return Mono.empty();
        }
        return cacheStore.setex(cacheKey, settings.ttl(), answerText)
            .onErrorResume(e -> Mono.just(CacheWriteResult.failed(e)))
            .defaultIfEmpty(CacheWriteResult.failed("store returned no result"))
            .doOnNext(outcome -> {
                if (outcome.isWritten()) {
                    log.debug("CACHE_WRITE key={} ttlSeconds={}", cacheKey, settings.ttl().toSeconds());
                } else {
                    log.warn("CACHE_WRITE_FAILED key={} reason={}", cacheKey, outcome.reason());
                }
            });
    }

    private static AskResponse toResponse(String rawQuery, String cacheKey, AnswerResult result,
                                          boolean fromCache, long startNanos) {
        long latencyMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        return new AskResponse(
            rawQuery,
            result.answerText(),
            fromCache,
            latencyMs,
            cacheKey,
            new AskResponse.Retrieval(result.matchKind().label()));
    }
}
