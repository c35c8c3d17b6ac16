package com.escrowengine.wallet;

import com.escrowengine.common.Money;
import com.escrowengine.ledger.LedgerEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a deposit or withdrawal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletTransactionResult {

    private String userId;
    private Money newBalance;
    private Money availableBalance;
    private Money reservedBalance;
    private LedgerEntry transaction;

    static WalletTransactionResult of(Wallet wallet, LedgerEntry transaction) {
        return WalletTransactionResult.builder()
            .userId(wallet.getUserId())
            .newBalance(wallet.getBalance())
            .availableBalance(wallet.getAvailableBalance())
            .reservedBalance(wallet.getReservedBalance())
            .transaction(transaction)
            .build();
    }
}
