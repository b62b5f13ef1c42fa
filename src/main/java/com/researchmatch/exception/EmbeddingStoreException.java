package com.researchmatch.exception;

/**
 * Exception thrown when a record cannot be written to or read from the store.
 */
public class EmbeddingStoreException extends ResearchMatchException {

    public EmbeddingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
