package com.cfoPilot.aiCfo.gateway.exception;

/**
 * Exception thrown when the acting user's role lacks access, or when an
 * approval-gated action is executed without approval.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
