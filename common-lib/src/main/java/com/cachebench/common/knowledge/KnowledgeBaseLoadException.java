package com.cachebench.common.knowledge;

import com.cachebench.common.exception.CacheBenchException;

/**
 * Thrown when a knowledge base source exists but cannot be read.
 * Individual malformed records never raise this.
 */
public class KnowledgeBaseLoadException extends CacheBenchException {

    public KnowledgeBaseLoadException(String message, Throwable cause) {
        super("KnowledgeBaseLoader", message, cause);
    }
}
