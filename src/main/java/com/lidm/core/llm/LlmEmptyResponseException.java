package com.lidm.core.llm;

/**
 * Thrown when a backend returns no content at all.
 */
public class LlmEmptyResponseException extends RuntimeException {
    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
