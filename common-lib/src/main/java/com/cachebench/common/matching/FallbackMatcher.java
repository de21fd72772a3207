package com.cachebench.common.matching;

import com.cachebench.common.knowledge.KnowledgeBase;
import com.cachebench.common.model.AnswerResult;
import com.cachebench.common.model.MatchKind;
import com.cachebench.common.model.QueryRecord;
import com.cachebench.common.text.KeyNormalizer;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stateless answer lookup used on the uncached path.
 *
 * <ol>
 *   <li><b>Exact</b>: the normalized query is a knowledge base key.</li>
 *   <li><b>Keyword</b>: otherwise score every key by the number of shared word tokens
 *       (see {@link KeyNormalizer#tokenize(String)}); the highest score wins, ties go to the
 *       first key in lexicographic order.</li>
 *   <li><b>Not found</b>: no key shares a token, answer is {@link #NOT_FOUND_ANSWER}.</li>
 * </ol>
 *
 * <p>Never throws and never returns an empty answer.
 */
public final class FallbackMatcher {

    public static final String NOT_FOUND_ANSWER =
        "Answer not found in the knowledge base. Try rephrasing the query.";

    private FallbackMatcher() {}

    public static AnswerResult match(String query, KnowledgeBase knowledgeBase) {
        String key = KeyNormalizer.normalize(query);

        Optional<QueryRecord> exact = knowledgeBase.find(key);
        if (exact.isPresent()) {
            return new AnswerResult(exact.get().answer(), MatchKind.EXACT);
        }

        Set<String> queryTokens = KeyNormalizer.tokenize(key);
        if (queryTokens.isEmpty()) {
            return notFound();
        }

        int bestScore = 0;
        QueryRecord best = null;
        for (Map.Entry<String, QueryRecord> entry : knowledgeBase.entries().entrySet()) {
            int score = overlap(queryTokens, KeyNormalizer.tokenize(entry.getKey()));
            // strict '>' keeps the earliest key on ties
            if (score > bestScore) {
                bestScore = score;
                best = entry.getValue();
            }
        }

        if (best != null) {
            return new AnswerResult(best.answer(), MatchKind.KEYWORD);
        }
        return notFound();
    }

    static int overlap(Set<String> queryTokens, Set<String> keyTokens) {
        int shared = 0;
        for (String token : keyTokens) {
            if (queryTokens.contains(token)) {
                shared++;
            }
        }
        return shared;
    }

    private static AnswerResult notFound() {
        return new AnswerResult(NOT_FOUND_ANSWER, MatchKind.NOT_FOUND);
    }
}
