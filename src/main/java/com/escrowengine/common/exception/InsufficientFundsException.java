package com.escrowengine.common.exception;

import com.escrowengine.common.Money;

/**
 * Thrown when a wallet's available balance does not cover a debit.
 */
public class InsufficientFundsException extends EscrowEngineException {

    private final Money available;
    private final Money requested;

    public InsufficientFundsException(String userId, Money requested, Money available) {
        super(String.format("Insufficient funds in wallet of %s. Requested: %s, Available: %s",
            userId, requested, available));
        this.available = available;
        this.requested = requested;
    }

    public Money getAvailable() {
        return available;
    }

    public Money getRequested() {
        return requested;
    }
}
