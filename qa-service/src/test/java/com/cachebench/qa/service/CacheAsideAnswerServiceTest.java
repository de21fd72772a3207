package com.cachebench.qa.service;

import com.cachebench.common.knowledge.KnowledgeBase;
import com.cachebench.common.latency.LatencySimulator;
import com.cachebench.common.matching.FallbackMatcher;
import com.cachebench.common.model.QueryRecord;
import com.cachebench.qa.cache.InMemoryAnswerCacheStore;
import com.cachebench.qa.dto.AskResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CacheAsideAnswerServiceTest {

    private static final KnowledgeBase KB = KnowledgeBase.of(
        new QueryRecord("what is caching", "storing results for reuse"),
        new QueryRecord("what is ttl", "time to live"));

    private static final Duration TTL = Duration.ofSeconds(3600);

    private InMemoryAnswerCacheStore store;
    private CountingLatencySimulator simulator;

    @BeforeEach
    void setUp() {
        store     = new InMemoryAnswerCacheStore();
        simulator = new CountingLatencySimulator(0);
    }

    private CacheAsideAnswerService service(CacheAsideSettings settings) {
        return new CacheAsideAnswerService(store, KB, simulator, settings);
    }

    private CacheAsideAnswerService enabled() {
        return service(new CacheAsideSettings(true, TTL, false));
    }

    private static AskResponse ask(CacheAsideAnswerService service, String query) {
        AskResponse response = service.handle(query).block(Duration.ofSeconds(5));
        assertNotNull(response);
        return response;
    }

    @Nested
    @DisplayName("cache enabled")
    class EnabledTests {

        @Test
        @DisplayName("same query twice → miss then hit with identical answer")
        void missThenHit() {
            CacheAsideAnswerService service = enabled();

            AskResponse first  = ask(service, "What is caching");
            AskResponse second = ask(service, "What is caching");

            assertFalse(first.fromCache());
            assertEquals("exact match", first.retrieval().match());
            assertTrue(second.fromCache());
            assertEquals("cache", second.retrieval().match());
            assertEquals(first.answer(), second.answer());
            assertEquals("qa:what is caching", second.cacheKey());
        }

        @Test
        @DisplayName("hit path does not simulate latency or write")
        void hitSkipsMissPath() {
            CacheAsideAnswerService service = enabled();
            ask(service, "what is ttl");
            int delaysAfterMiss = simulator.calls();
            int writesAfterMiss = store.writes();

            ask(service, "what is ttl");

            assertEquals(delaysAfterMiss, simulator.calls());
            assertEquals(writesAfterMiss, store.writes());
        }

        @Test
        @DisplayName("queries normalizing to the same key share one cache entry")
        void normalizedKeysCollide() {
            CacheAsideAnswerService service = enabled();

            AskResponse first  = ask(service, "  WHAT   is  TTL ");
            AskResponse second = ask(service, "what is ttl");

            assertTrue(second.fromCache());
            assertEquals(first.cacheKey(), second.cacheKey());
            assertEquals("time to live", second.answer());
        }

        @Test
        @DisplayName("miss writes the answer with the configured TTL")
        void writesWithTtl() {
            ask(enabled(), "What is caching?");

            assertEquals("storing results for reuse", store.values().get("qa:what is caching?"));
            assertEquals(TTL, store.lastTtl());
            assertEquals(1, store.reads());
            assertEquals(1, store.writes());
        }

        @Test
        @DisplayName("not-found answers are cached like any other")
        void notFoundCached() {
            CacheAsideAnswerService service = enabled();

            AskResponse first = ask(service, "kubernetes autoscaling");

            assertEquals("no match", first.retrieval().match());
            assertEquals(FallbackMatcher.NOT_FOUND_ANSWER, first.answer());
            assertTrue(ask(service, "kubernetes autoscaling").fromCache());
        }

        @Test
        @DisplayName("read error → treated as miss, request still succeeds")
        void readErrorFailsOpen() {
            store.failReads(true);

            AskResponse response = ask(enabled(), "what is caching");

            assertFalse(response.fromCache());
            assertEquals("storing results for reuse", response.answer());
            assertEquals(1, simulator.calls());
        }

        @Test
        @DisplayName("write error is swallowed; fresh answer returned")
        void writeErrorSwallowed() {
            store.failWrites(true);

            StepVerifier.create(enabled().handle("what is caching"))
                .assertNext(response -> {
                    assertFalse(response.fromCache());
                    assertEquals("storing results for reuse", response.answer());
                })
                .verifyComplete();
            assertTrue(store.values().isEmpty());
        }

        @Test
        @DisplayName("latency_ms reflects the simulated delay on a miss")
        void latencyIncludesSimulatedDelay() {
            simulator = new CountingLatencySimulator(60);

            AskResponse response = ask(enabled(), "what is ttl");

            assertTrue(response.latencyMs() >= 60, "latency was " + response.latencyMs());
        }
    }

    @Nested
    @DisplayName("cache disabled (control run)")
    class DisabledTests {

        @Test
        @DisplayName("every request recomputes; store is never touched")
        void alwaysRecomputes() {
            CacheAsideAnswerService service = service(CacheAsideSettings.disabled());

            AskResponse first  = ask(service, "what is caching");
            AskResponse second = ask(service, "what is caching");

            assertFalse(first.fromCache());
            assertFalse(second.fromCache());
            assertEquals(2, simulator.calls());
            assertEquals(0, store.reads());
            assertEquals(0, store.writes());
        }
    }

    @Nested
    @DisplayName("concurrent misses on one key")
    class ConcurrencyTests {

        @Test
        @DisplayName("without single-flight each miss computes and writes")
        void duplicatesAllowed() {
            simulator = new CountingLatencySimulator(100);
            CacheAsideAnswerService service = enabled();

            List<AskResponse> responses = concurrently(service, "what is caching", 5);

            assertEquals(5, responses.size());
            assertEquals(5, simulator.calls());
            assertEquals(5, store.writes());
            responses.forEach(r -> assertEquals("storing results for reuse", r.answer()));
        }

        @Test
        @DisplayName("with single-flight concurrent misses collapse into one computation")
        void singleFlightCollapses() {
            simulator = new CountingLatencySimulator(100);
            CacheAsideAnswerService service = service(new CacheAsideSettings(true, TTL, true));

            List<AskResponse> responses = concurrently(service, "what is caching", 5);

            assertEquals(5, responses.size());
            assertEquals(1, simulator.calls());
            assertEquals(1, store.writes());
            responses.forEach(r -> assertFalse(r.fromCache()));
        }

        private List<AskResponse> concurrently(CacheAsideAnswerService service, String query, int n) {
            List<Mono<AskResponse>> calls = Flux.range(0, n)
                .map(i -> service.handle(query))
                .collectList()
                .block();
            return Flux.merge(calls).collectList().block(Duration.ofSeconds(5));
        }
    }

    /** Records how often the miss path asked for a delay. */
    static class CountingLatencySimulator extends LatencySimulator {

        private final AtomicInteger calls = new AtomicInteger();

        CountingLatencySimulator(long baseMillis) {
            super(baseMillis, 0);
        }

        @Override
        public Duration delay() {
            calls.incrementAndGet();
            return super.delay();
        }

        int calls() {
            return calls.get();
        }
    }
}
