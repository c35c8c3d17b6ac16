package com.escrowengine.common.exception;

/**
 * Thrown when the payment gateway refuses to authorize a card deposit.
 */
public class PaymentDeclinedException extends EscrowEngineException {

    private final String declineReason;

    public PaymentDeclinedException(String reason) {
        super("Payment declined: " + reason);
        this.declineReason = reason;
    }

    public PaymentDeclinedException(String reason, Throwable cause) {
        super("Payment declined: " + reason, cause);
        this.declineReason = reason;
    }

    public String getDeclineReason() {
        return declineReason;
    }
}
