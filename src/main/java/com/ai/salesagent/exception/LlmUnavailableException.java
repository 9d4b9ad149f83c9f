package com.ai.salesagent.exception;

/**
 * The chat completion provider is not configured or did not return a usable reply.
 */
public class LlmUnavailableException extends RuntimeException {

    public LlmUnavailableException(String message) {
        super(message);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
