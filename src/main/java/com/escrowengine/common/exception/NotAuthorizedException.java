package com.escrowengine.common.exception;

/**
 * Thrown when the caller is not the party allowed to perform an escrow transition.
 */
public class NotAuthorizedException extends EscrowEngineException {

    public NotAuthorizedException(String callerId, String operation, String escrowId) {
        super(String.format("User %s is not authorized to %s escrow %s",
            callerId, operation, escrowId));
    }
}
