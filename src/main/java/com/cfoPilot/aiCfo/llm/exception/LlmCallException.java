package com.cfoPilot.aiCfo.llm.exception;

/**
 * Language call failed for a reason other than rate limiting
 * (not configured, auth failure, transport error, empty body).
 */
public class LlmCallException extends RuntimeException {

    public LlmCallException(String message) {
        super(message);
    }

    public LlmCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
