package com.escrowengine.common.exception;

/**
 * Base exception for all escrow engine failures.
 *
 * {@link #isRetryable()} tells the caller whether repeating the same request
 * unchanged may succeed.
 */
public class EscrowEngineException extends RuntimeException {

    public EscrowEngineException(String message) {
        super(message);
    }

    public EscrowEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
