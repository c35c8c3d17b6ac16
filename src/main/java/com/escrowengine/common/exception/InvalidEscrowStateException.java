package com.escrowengine.common.exception;

import com.escrowengine.escrow.EscrowStatus;

/**
 * Thrown when an escrow transition is attempted from the wrong status.
 *
 * Usually another actor moved the escrow first, so a caller that re-reads the
 * escrow may decide to try again.
 */
public class InvalidEscrowStateException extends EscrowEngineException {

    private final String escrowId;
    private final EscrowStatus current;
    private final EscrowStatus required;

    public InvalidEscrowStateException(String escrowId, EscrowStatus current, EscrowStatus required) {
        super(String.format("Escrow %s is %s, expected %s",
            escrowId, current.getCode(), required.getCode()));
        this.escrowId = escrowId;
        this.current = current;
        this.required = required;
    }

    public String getEscrowId() {
        return escrowId;
    }

    public EscrowStatus getCurrent() {
        return current;
    }

    public EscrowStatus getRequired() {
        return required;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
