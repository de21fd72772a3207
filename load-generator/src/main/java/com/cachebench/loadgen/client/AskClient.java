package com.cachebench.loadgen.client;

import com.cachebench.common.model.LatencySample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Issues one POST /ask and turns the round trip into a {@link LatencySample}.
 *
 * <p>Timing runs from just before the request is sent until the response body is fully
 * decoded. Any failure (connection error, non-2xx status, timeout, undecodable body) still
 * yields a sample with the elapsed time and {@code cacheHit=false}; this Mono never errors.
 */
public class AskClient {

    private static final Logger log = LoggerFactory.getLogger(AskClient.class);

    private final WebClient webClient;
    private final Duration requestTimeout;

    public AskClient(WebClient webClient, Duration requestTimeout) {
        this.webClient      = webClient;
        this.requestTimeout = requestTimeout;
    }

    public Mono<LatencySample> ask(String query) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return webClient.post()
                .uri("/ask")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", query))
                .retrieve()
                .bodyToMono(AskReply.class)
                .timeout(requestTimeout)
                .map(reply -> LatencySample.success(elapsedMillis(startNanos), reply.fromCache()))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("Empty /ask response. query={}", query);
                    return LatencySample.failure(elapsedMillis(startNanos));
                }))
                .onErrorResume(e -> {
                    double elapsed = elapsedMillis(startNanos);
                    log.debug("Request failed. query={} elapsedMs={} reason={}", query, Math.round(elapsed), e.toString());
                    return Mono.just(LatencySample.failure(elapsed));
                });
        });
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
