package com.cachebench.common.model;

/**
 * One question/answer pair from the knowledge base source. Immutable.
 */
public record QueryRecord(
    String question,
    String answer
) {}
