package com.cfoPilot.aiCfo.llm.exception;

/**
 * Provider rejected the call with HTTP 429, or a 403 whose body mentions quota or rate limits.
 */
public class LlmRateLimitedException extends LlmCallException {

    private final int statusCode;

    public LlmRateLimitedException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
