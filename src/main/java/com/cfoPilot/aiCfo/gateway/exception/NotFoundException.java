package com.cfoPilot.aiCfo.gateway.exception;

/**
 * Exception thrown when a plan or model run referenced by id does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
