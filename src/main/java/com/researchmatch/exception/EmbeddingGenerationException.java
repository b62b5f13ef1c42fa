package com.researchmatch.exception;

/**
 * Exception thrown when the embedding provider fails to produce a vector.
 * Callers decide whether to retry.
 */
public class EmbeddingGenerationException extends ResearchMatchException {

    public EmbeddingGenerationException(String message) {
        super(message);
    }

    public EmbeddingGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
