package com.cachebench.loadgen.report;

import com.cachebench.common.stats.LatencySummary;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Console rendering of a {@link BenchmarkReport}.
 */
public final class ReportPrinter {

    private ReportPrinter() {}

    public static void print(BenchmarkReport report, PrintStream out) {
        out.print(format(report));
        out.flush();
    }

    public static String format(BenchmarkReport report) {
        LatencySummary s = report.summary();
        if (s.isEmpty()) {
            return System.lineSeparator() + "No samples collected; nothing to report." + System.lineSeparator();
        }
        StringBuilder sb = new StringBuilder();
        String nl = System.lineSeparator();
        sb.append(nl).append("=== Load run results ===").append(nl);
        sb.append(String.format(Locale.ROOT, "Requests: %d, failures: %d, cache hit-rate: %.1f%%",
            s.total(), s.failures(), s.hitRatePercent())).append(nl);
        sb.append(String.format(Locale.ROOT, "Latency (ms): p50=%.0f  p95=%.0f  p99=%.0f  mean=%.0f",
            s.p50Millis(), s.p95Millis(), s.p99Millis(), s.meanMillis())).append(nl);
        sb.append(String.format(Locale.ROOT, "Target p95 < %.0f ms: %s",
            report.targetP95Millis(), report.passed() ? "OK" : "NOT MET")).append(nl);
        return sb.toString();
    }
}
