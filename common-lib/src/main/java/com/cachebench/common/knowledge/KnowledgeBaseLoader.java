package com.cachebench.common.knowledge;

import com.cachebench.common.model.QueryRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a JSON-lines knowledge base where every line is {@code {"q": "...", "a": "..."}}.
 *
 * <ul>
 *   <li>Missing file → empty {@link KnowledgeBase}, not an error.</li>
 *   <li>Blank lines are ignored.</li>
 *   <li>Unparseable lines and records without a usable {@code q}/{@code a} are skipped and logged.</li>
 *   <li>Duplicate questions (after normalization): the later line wins.</li>
 * </ul>
 */
public class KnowledgeBaseLoader {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseLoader.class);

    static final String QUESTION_FIELD = "q";
    static final String ANSWER_FIELD   = "a";

    private final ObjectMapper objectMapper;

    public KnowledgeBaseLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public KnowledgeBase load(Path source) {
        if (source == null || !Files.exists(source)) {
            log.info("KB_SOURCE_MISSING path={} starting with an empty knowledge base", source);
            return KnowledgeBase.empty();
        }

        KnowledgeBase.Builder builder = KnowledgeBase.builder();
        int lineNumber = 0;
        int loaded     = 0;
        int skipped    = 0;

        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                QueryRecord record = parse(trimmed, lineNumber, source);
                if (record != null && builder.put(record)) {
                    loaded++;
                } else {
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new KnowledgeBaseLoadException("Failed to read knowledge base " + source, e);
        }

        KnowledgeBase kb = builder.build();
        log.info("KB_LOADED path={} records={} uniqueQuestions={} skipped={}",
                 source, loaded, kb.size(), skipped);
        return kb;
    }

    private QueryRecord parse(String line, int lineNumber, Path source) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("KB_RECORD_SKIPPED path={} line={} reason=invalid JSON: {}",
                     source, lineNumber, e.getOriginalMessage());
            return null;
        }
        JsonNode question = node.path(QUESTION_FIELD);
        JsonNode answer   = node.path(ANSWER_FIELD);
        if (!question.isTextual() || question.asText().isBlank()) {
            log.warn("KB_RECORD_SKIPPED path={} line={} reason=missing '{}'", source, lineNumber, QUESTION_FIELD);
            return null;
        }
        if (!answer.isTextual()) {
            log.warn("KB_RECORD_SKIPPED path={} line={} reason=missing '{}'", source, lineNumber, ANSWER_FIELD);
            return null;
        }
        return new QueryRecord(question.asText(), answer.asText());
    }
}
