package com.escrowengine.common.exception;

/**
 * Thrown when a request is malformed or misses a required value.
 */
public class ValidationException extends EscrowEngineException {

    public ValidationException(String message) {
        super(message);
    }
}
