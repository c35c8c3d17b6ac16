package com.escrowengine.escrow;

import java.util.Locale;

/**
 * Lifecycle states of an escrow.
 *
 * <pre>
 * CREATED -> FUNDED -> IN_PROGRESS -> DELIVERED -> APPROVED
 *              |                          |
 *              v                          v
 *          CANCELLED                  DISPUTED -> REFUNDED | RELEASED
 * </pre>
 */
public enum EscrowStatus {
    /**
     * Escrow exists but is not funded yet. Funding is part of creation,
     * so this state is never committed.
     */
    CREATED,

    /**
     * Client funds are debited and the escrow amount is reserved on the client wallet.
     */
    FUNDED,

    /**
     * Freelancer accepted the work.
     */
    IN_PROGRESS,

    /**
     * Freelancer handed in the work and waits for the client's decision.
     */
    DELIVERED,

    /**
     * Client accepted the delivery and the freelancer was paid.
     */
    APPROVED,

    /**
     * Client rejected the delivery. Funds stay reserved until the dispute is resolved.
     */
    DISPUTED,

    /**
     * Dispute resolved in favour of the client.
     */
    REFUNDED,

    /**
     * Dispute resolved in favour of the freelancer.
     */
    RELEASED,

    /**
     * Client withdrew the escrow before work started.
     */
    CANCELLED;

    /**
     * Whether the client wallet must hold a reserve entry for an escrow in this state.
     */
    public boolean holdsReserve() {
        return switch (this) {
            case FUNDED, IN_PROGRESS, DELIVERED, DISPUTED -> true;
            case CREATED, APPROVED, REFUNDED, RELEASED, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return switch (this) {
            case APPROVED, REFUNDED, RELEASED, CANCELLED -> true;
            case CREATED, FUNDED, IN_PROGRESS, DELIVERED, DISPUTED -> false;
        };
    }

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
