package com.ouroboros.core.llm;

/**
 * Thrown when the reasoning service answers with no content at all.
 */
public class LlmEmptyResponseException extends RuntimeException {
    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
