package com.escrowengine.escrow;

/**
 * Decision closing a dispute.
 */
public enum DisputeOutcome {
    /**
     * Escrow amount goes back to the client.
     */
    REFUND(EscrowAction.REFUND),

    /**
     * Escrow amount is paid to the freelancer, as on approval.
     */
    RELEASE(EscrowAction.RELEASE);

    private final EscrowAction action;

    DisputeOutcome(EscrowAction action) {
        this.action = action;
    }

    public EscrowAction getAction() {
        return action;
    }
}
