package com.cachebench.common.text;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical form of query text, shared by the cache key and the knowledge base key.
 *
 * <p>{@link #normalize(String)} trims, lower-cases and collapses every whitespace run into
 * a single space. Punctuation is kept as-is, so {@code "What is caching?"} and
 * {@code "what is caching"} are different keys.
 *
 * <p>Both the cache-aside handler and the fallback matcher must go through this class;
 * two code paths that normalize differently would never see each other's entries.
 */
public final class KeyNormalizer {

    /** Tokens of this many code points or fewer are ignored by word matching. */
    static final int MIN_TOKEN_EXCLUSIVE = 2;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WORD       = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private KeyNormalizer() {}

    /**
     * @param text raw query text, may be {@code null}
     * @return the canonical key; {@code ""} for {@code null} or blank input
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        // collapse before trimming: strip() alone misses no-break spaces that \s matches
        String collapsed = WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return collapsed.strip();
    }

    /**
     * Word tokens of the normalized text that are longer than two characters.
     * Order of first occurrence is preserved; duplicates are dropped.
     */
    public static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        Matcher m = WORD.matcher(normalize(text));
        while (m.find()) {
            String token = m.group();
            if (token.codePointCount(0, token.length()) > MIN_TOKEN_EXCLUSIVE) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
