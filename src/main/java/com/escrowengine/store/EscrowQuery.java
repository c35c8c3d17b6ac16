package com.escrowengine.store;

import com.escrowengine.escrow.Escrow;
import com.escrowengine.escrow.EscrowParty;
import com.escrowengine.escrow.EscrowStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filter for listing the escrows of one user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscrowQuery {

    private String userId;

    /**
     * {@link EscrowParty#CLIENT} or {@link EscrowParty#FREELANCER}; null matches either side.
     */
    private EscrowParty role;

    /**
     * Null matches every status.
     */
    private EscrowStatus status;

    public boolean matches(Escrow escrow) {
        boolean party;
        if (role == null) {
            party = userId.equals(escrow.getClientId()) || userId.equals(escrow.getFreelancerId());
        } else {
            party = switch (role) {
                case CLIENT -> userId.equals(escrow.getClientId());
                case FREELANCER -> userId.equals(escrow.getFreelancerId());
                case ARBITER -> false;
            };
        }
        return party && (status == null || status == escrow.getStatus());
    }
}
