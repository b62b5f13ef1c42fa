package com.researchmatch.exception;

/**
 * Base exception for embedding storage and similarity operations.
 */
public class ResearchMatchException extends RuntimeException {

    public ResearchMatchException(String message) {
        super(message);
    }

    public ResearchMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
