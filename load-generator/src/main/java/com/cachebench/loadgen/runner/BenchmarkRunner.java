package com.cachebench.loadgen.runner;

import com.cachebench.loadgen.config.BenchmarkSettings;
import com.cachebench.loadgen.exception.BenchmarkConfigurationException;
import com.cachebench.loadgen.report.BenchmarkReport;
import com.cachebench.loadgen.report.ReportPrinter;
import com.cachebench.loadgen.workload.QueryPoolLoader;
import com.cachebench.loadgen.workload.QuerySelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one benchmark on startup and prints the report to stdout.
 *
 * <p>Exit codes: {@code 0} run completed (whatever the verdict), {@code 2} configuration
 * error detected before any traffic was generated.
 */
@Component
public class BenchmarkRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkRunner.class);

    static final int EXIT_CONFIGURATION_ERROR = 2;

    private final BenchmarkSettings settings;
    private final LoadGenerator loadGenerator;

    private int exitCode = 0;

    public BenchmarkRunner(BenchmarkSettings settings, LoadGenerator loadGenerator) {
        this.settings      = settings;
        this.loadGenerator = loadGenerator;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> queries;
        try {
            queries = QueryPoolLoader.load(Path.of(settings.queriesFile()));
        } catch (BenchmarkConfigurationException e) {
            log.error("BENCHMARK_NOT_STARTED component={} reason={}", e.getComponent(), e.getReason());
            exitCode = EXIT_CONFIGURATION_ERROR;
            return;
        }

        QuerySelector selector = new QuerySelector(queries, settings.repeatRatio());
        BenchmarkReport report = loadGenerator.run(settings, selector).block();
        if (report != null) {
            ReportPrinter.print(report, System.out);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
