package com.cachebench.loadgen.workload;

import com.cachebench.loadgen.exception.BenchmarkConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the benchmark query list: one query per line, trimmed, blank lines dropped.
 */
public final class QueryPoolLoader {

    private static final Logger log = LoggerFactory.getLogger(QueryPoolLoader.class);

    private QueryPoolLoader() {}

    /**
     * @throws BenchmarkConfigurationException when the file cannot be read or holds no queries
     */
    public static List<String> load(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BenchmarkConfigurationException("Cannot read queries file " + path, e);
        }

        List<String> queries = lines.stream()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toUnmodifiableList());

        if (queries.isEmpty()) {
            throw new BenchmarkConfigurationException("Queries file is empty: " + path);
        }
        log.info("Query pool loaded. path={} queries={}", path, queries.size());
        return queries;
    }
}
