package com.escrowengine.escrow;

import com.escrowengine.common.Money;
import com.escrowengine.ledger.LedgerEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A newly funded escrow together with the ledger entry that funded it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscrowCreationResult {

    private Escrow escrow;
    private LedgerEntry transaction;
    private Money platformFee;
    private Money totalAmount;
}
