package com.escrowengine.escrow;

import com.escrowengine.ledger.LedgerEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A closed escrow and the ledger entry that paid out its reserve.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscrowSettlement {

    private Escrow escrow;
    private LedgerEntry transaction;
}
