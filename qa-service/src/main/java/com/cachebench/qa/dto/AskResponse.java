package com.cachebench.qa.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body for POST /ask.
 *
 * <p>{@code retrieval.match} carries the human-readable match label:
 * {@code "exact match"}, {@code "by words"}, {@code "no match"} or {@code "cache"}.
 */
public record AskResponse(
    @JsonProperty("query")      String query,
    @JsonProperty("answer")     String answer,
    @JsonProperty("from_cache") boolean fromCache,
    @JsonProperty("latency_ms") long latencyMs,
    @JsonProperty("cache_key")  String cacheKey,
    @JsonProperty("retrieval")  Retrieval retrieval
) {

    public record Retrieval(
        @JsonProperty("match") String match
    ) {}
}
