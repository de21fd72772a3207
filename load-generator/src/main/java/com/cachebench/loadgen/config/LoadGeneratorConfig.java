package com.cachebench.loadgen.config;

import com.cachebench.loadgen.client.AskClient;
import com.cachebench.loadgen.runner.LoadGenerator;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class LoadGeneratorConfig {

    @Value("${bench.host:http://127.0.0.1:8088}")
    private String host;

    @Value("${bench.rps:5}")
    private double rps;

    @Value("${bench.duration-seconds:120}")
    private long durationSeconds;

    @Value("${bench.warmup-seconds:10}")
    private long warmupSeconds;

    @Value("${bench.queries-file:data/bench_queries.txt}")
    private String queriesFile;

    @Value("${bench.repeat-ratio:0.7}")
    private double repeatRatio;

    @Value("${bench.request-timeout-seconds:30}")
    private long requestTimeoutSeconds;

    @Value("${bench.target-p95-ms:900}")
    private double targetP95Millis;

    @Bean
    public BenchmarkSettings benchmarkSettings() {
        return new BenchmarkSettings(
            host,
            rps,
            Duration.ofSeconds(durationSeconds),
            Duration.ofSeconds(warmupSeconds),
            queriesFile,
            repeatRatio,
            Duration.ofSeconds(requestTimeoutSeconds),
            targetP95Millis);
    }

    @Bean
    public WebClient qaServiceWebClient(WebClient.Builder builder, BenchmarkSettings settings) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(settings.requestTimeout());

        return builder
            .baseUrl(settings.host())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public AskClient askClient(WebClient qaServiceWebClient, BenchmarkSettings settings) {
        return new AskClient(qaServiceWebClient, settings.requestTimeout());
    }

    @Bean
    public LoadGenerator loadGenerator(AskClient askClient) {
        return new LoadGenerator(askClient);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            org.slf4j.LoggerFactory.getLogger(LoadGeneratorConfig.class)
                .trace("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
