package com.cachebench.common.model;

/**
 * How an answer was produced. The label is what the HTTP API reports under
 * {@code retrieval.match}.
 */
public enum MatchKind {
    EXACT("exact match"),
    KEYWORD("by words"),
    NOT_FOUND("no match"),
    CACHE_HIT("cache");

    private final String label;

    MatchKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
