package com.cachebench.loadgen.client;

import com.cachebench.common.model.LatencySample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AskClientTest {

    private static AskClient clientReturning(ExchangeFunction exchange, Duration timeout) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://qa.test:8088")
            .exchangeFunction(exchange)
            .build();
        return new AskClient(webClient, timeout);
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    @Test
    @DisplayName("POSTs to /ask and reads from_cache=true as a hit")
    void cacheHit() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        AskClient client = clientReturning(request -> {
            seen.set(request);
            return json(HttpStatus.OK, "{\"query\":\"q\",\"answer\":\"a\",\"from_cache\":true,\"latency_ms\":1}");
        }, Duration.ofSeconds(30));

        StepVerifier.create(client.ask("what is ttl"))
            .assertNext(sample -> {
                assertTrue(sample.cacheHit());
                assertFalse(sample.failed());
                assertTrue(sample.elapsedMillis() >= 0.0);
            })
            .verifyComplete();

        assertEquals(HttpMethod.POST, seen.get().method());
        assertEquals("/ask", seen.get().url().getPath());
    }

    @Test
    @DisplayName("from_cache=false → successful miss")
    void cacheMiss() {
        AskClient client = clientReturning(
            request -> json(HttpStatus.OK, "{\"from_cache\":false}"), Duration.ofSeconds(30));

        StepVerifier.create(client.ask("q"))
            .assertNext(sample -> {
                assertFalse(sample.cacheHit());
                assertFalse(sample.failed());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("non-2xx status → failed sample, never a hit")
    void serverError() {
        AskClient client = clientReturning(
            request -> json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"from_cache\":true}"), Duration.ofSeconds(30));

        StepVerifier.create(client.ask("q"))
            .assertNext(sample -> {
                assertTrue(sample.failed());
                assertFalse(sample.cacheHit());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("connection error → failed sample, no error signal")
    void networkError() {
        AskClient client = clientReturning(
            request -> Mono.error(new IOException("connection refused")), Duration.ofSeconds(30));

        StepVerifier.create(client.ask("q"))
            .assertNext(sample -> assertTrue(sample.failed()))
            .verifyComplete();
    }

    @Test
    @DisplayName("timeout → failed sample whose elapsed time covers the wait")
    void timeout() {
        AskClient client = clientReturning(request -> Mono.never(), Duration.ofMillis(150));

        StepVerifier.create(client.ask("q"))
            .assertNext(sample -> {
                assertTrue(sample.failed());
                assertTrue(sample.elapsedMillis() >= 150.0, "elapsed " + sample.elapsedMillis());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("undecodable body → failed sample")
    void badBody() {
        AskClient client = clientReturning(
            request -> json(HttpStatus.OK, "not-json"), Duration.ofSeconds(30));

        LatencySample sample = client.ask("q").block(Duration.ofSeconds(5));

        assertNotNull(sample);
        assertTrue(sample.failed());
    }
}
