package com.escrowengine.ledger;

import com.escrowengine.common.Money;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Comparison of a wallet balance with the sum of the user's transaction log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReport {

    private String userId;

    private Money walletBalance;

    /**
     * Sum of every signed entry amount of the user.
     */
    private Money ledgerTotal;

    /**
     * {@code walletBalance - ledgerTotal}; zero when the two agree.
     */
    private Money difference;

    private int entryCount;

    public boolean isBalanced() {
        return !difference.isPositive() && !difference.isNegative();
    }
}
