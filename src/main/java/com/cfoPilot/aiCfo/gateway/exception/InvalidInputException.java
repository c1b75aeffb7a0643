package com.cfoPilot.aiCfo.gateway.exception;

/**
 * Exception thrown when a request is malformed (blank query, bad UUID).
 * Rejected before the request reaches the pipeline.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
