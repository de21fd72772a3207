package com.cachebench.loadgen.runner;

import com.cachebench.common.model.LatencySample;
import com.cachebench.common.stats.LatencyStatistics;
import com.cachebench.loadgen.client.AskClient;
import com.cachebench.loadgen.config.BenchmarkSettings;
import com.cachebench.loadgen.report.BenchmarkReport;
import com.cachebench.loadgen.workload.QuerySelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Paced request driver: a warmup phase whose outcomes are discarded, then a measured phase.
 *
 * <p>Each cycle of the single pacing loop is
 * <pre>
 *   deadline passed? → stop
 *   select query → POST /ask (await response) → record → Mono.delay(1 / rps) → repeat
 * </pre>
 * The pause after each response is fixed and does not shrink when the service is slow, so
 * the realised rate is at most the configured rate. Phases are bounded only by their
 * wall-clock deadlines; a request already in flight when a deadline passes is still
 * recorded.
 */
public class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private final AskClient askClient;

    public LoadGenerator(AskClient askClient) {
        this.askClient = askClient;
    }

    public Mono<BenchmarkReport> run(BenchmarkSettings settings, QuerySelector selector) {
        Duration interval = settings.dispatchInterval();
        List<LatencySample> samples = Collections.synchronizedList(new ArrayList<>());

        return Mono.fromRunnable(() -> log.info(
                "WARMUP_STARTED host={} rps={} warmupSeconds={} popularQueries={}",
                settings.host(), settings.rps(), settings.warmup().toSeconds(), selector.popularQueries().size()))
            .then(phase(settings.warmup(), interval, selector, sample -> {}))
            .then(Mono.fromRunnable(() -> log.info(
                "MEASUREMENT_STARTED durationSeconds={} repeatRatio={}",
                settings.duration().toSeconds(), settings.repeatRatio())))
            .then(phase(settings.duration(), interval, selector, samples::add))
            .then(Mono.fromSupplier(() -> {
                List<LatencySample> snapshot;
                synchronized (samples) {
                    snapshot = List.copyOf(samples);
                }
                BenchmarkReport report = new BenchmarkReport(
                    LatencyStatistics.summarize(snapshot), settings.targetP95Millis());
                log.info("MEASUREMENT_FINISHED samples={} hitRatePercent={} p95Ms={} passed={}",
                         report.summary().total(), report.summary().hitRatePercent(),
                         report.summary().p95Millis(), report.passed());
                return report;
            }));
    }

    private Mono<Void> phase(Duration length, Duration interval, QuerySelector selector,
                             Consumer<LatencySample> recorder) {
        return Mono.defer(() -> {
            long deadline = System.nanoTime() + length.toNanos();
            BooleanSupplier open = () -> System.nanoTime() - deadline < 0;
            if (!open.getAsBoolean()) {
                return Mono.empty();
            }
            Mono<Void> cycle = Mono.defer(() -> askClient.ask(selector.next()))
                .doOnNext(recorder)
                .then(Mono.delay(interval))
                .then();
            return cycle.repeat(open).then();
        });
    }
}
