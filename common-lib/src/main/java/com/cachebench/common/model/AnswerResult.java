package com.cachebench.common.model;

/**
 * Per-request answer produced either by the fallback matcher or by a cache hit.
 * Only {@code answerText} survives into the cache.
 */
public record AnswerResult(
    String answerText,
    MatchKind matchKind
) {

    public static AnswerResult cached(String answerText) {
        return new AnswerResult(answerText, MatchKind.CACHE_HIT);
    }
}
