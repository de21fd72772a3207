package com.cachebench.common.knowledge;

import com.cachebench.common.model.QueryRecord;
import com.cachebench.common.text.KeyNormalizer;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read-only question→answer mapping keyed by {@link KeyNormalizer#normalize(String) normalized}
 * question text.
 *
 * <p>Built once at startup and handed to the request handler at construction time, never
 * reinitialised afterwards, so concurrent reads need no locking.
 *
 * <p>Entries iterate in lexicographic key order. The fallback matcher's tie-break
 * ("first maximal score wins") relies on this order being stable.
 */
public final class KnowledgeBase {

    private static final KnowledgeBase EMPTY = new KnowledgeBase(new TreeMap<>());

    private final SortedMap<String, QueryRecord> records;

    private KnowledgeBase(TreeMap<String, QueryRecord> records) {
        this.records = Collections.unmodifiableSortedMap(records);
    }

    public static KnowledgeBase empty() {
        return EMPTY;
    }

    public static KnowledgeBase of(QueryRecord... records) {
        Builder builder = builder();
        for (QueryRecord record : records) {
            builder.put(record);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Exact lookup by an already normalized key. */
    public Optional<QueryRecord> find(String normalizedKey) {
        return Optional.ofNullable(records.get(normalizedKey));
    }

    /** All entries, lexicographic by key. */
    public Map<String, QueryRecord> entries() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Accumulates records; a later record whose question normalizes to an existing key
     * replaces the earlier one. Records with a blank normalized question are ignored.
     */
    public static final class Builder {

        private final TreeMap<String, QueryRecord> records = new TreeMap<>();

        private Builder() {}

        /**
         * @return {@code true} if the record was stored
         */
        public boolean put(QueryRecord record) {
            String key = KeyNormalizer.normalize(record.question());
            if (key.isEmpty()) {
                return false;
            }
            records.put(key, record);
            return true;
        }

        public KnowledgeBase build() {
            return records.isEmpty() ? EMPTY : new KnowledgeBase(new TreeMap<>(records));
        }
    }
}
