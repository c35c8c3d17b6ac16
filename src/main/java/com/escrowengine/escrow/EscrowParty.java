package com.escrowengine.escrow;

/**
 * The party allowed to drive a given escrow transition.
 */
public enum EscrowParty {
    CLIENT,
    FREELANCER,

    /**
     * Platform operator settling a dispute.
     */
    ARBITER
}
