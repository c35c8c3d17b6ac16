package com.escrowengine.escrow;

import java.util.Locale;

/**
 * Transitions of the escrow state machine, each with the status it requires,
 * the status it produces, and the party allowed to trigger it.
 */
public enum EscrowAction {
    START(EscrowStatus.FUNDED, EscrowStatus.IN_PROGRESS, EscrowParty.FREELANCER),
    DELIVER(EscrowStatus.IN_PROGRESS, EscrowStatus.DELIVERED, EscrowParty.FREELANCER),
    APPROVE(EscrowStatus.DELIVERED, EscrowStatus.APPROVED, EscrowParty.CLIENT),
    REJECT(EscrowStatus.DELIVERED, EscrowStatus.DISPUTED, EscrowParty.CLIENT),
    CANCEL(EscrowStatus.FUNDED, EscrowStatus.CANCELLED, EscrowParty.CLIENT),
    REFUND(EscrowStatus.DISPUTED, EscrowStatus.REFUNDED, EscrowParty.ARBITER),
    RELEASE(EscrowStatus.DISPUTED, EscrowStatus.RELEASED, EscrowParty.ARBITER);

    private final EscrowStatus requiredStatus;
    private final EscrowStatus targetStatus;
    private final EscrowParty party;

    EscrowAction(EscrowStatus requiredStatus, EscrowStatus targetStatus, EscrowParty party) {
        this.requiredStatus = requiredStatus;
        this.targetStatus = targetStatus;
        this.party = party;
    }

    public EscrowStatus getRequiredStatus() {
        return requiredStatus;
    }

    public EscrowStatus getTargetStatus() {
        return targetStatus;
    }

    public EscrowParty getParty() {
        return party;
    }

    public String getVerb() {
        return name().toLowerCase(Locale.ROOT);
    }
}
