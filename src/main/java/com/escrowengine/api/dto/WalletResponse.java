package com.escrowengine.api.dto;

import com.escrowengine.common.Currency;
import com.escrowengine.common.Money;
import com.escrowengine.wallet.EscrowReserve;
import com.escrowengine.wallet.Wallet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view of a wallet with its derived balances.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletResponse {

    private String walletId;
    private String userId;
    private Currency currency;
    private Money balance;
    private Money reservedBalance;
    private Money availableBalance;
    private List<EscrowReserve> escrowReserves;
    private List<PaymentMethodResponse> paymentMethods;
    private Instant createdAt;
    private Instant updatedAt;

    public static WalletResponse from(Wallet wallet) {
        return WalletResponse.builder()
            .walletId(wallet.getWalletId())
            .userId(wallet.getUserId())
            .currency(wallet.getCurrency())
            .balance(wallet.getBalance())
            .reservedBalance(wallet.getReservedBalance())
            .availableBalance(wallet.getAvailableBalance())
            .escrowReserves(wallet.getEscrowReserves())
            .paymentMethods(wallet.getPaymentMethods().stream()
                .map(PaymentMethodResponse::from)
                .collect(Collectors.toList()))
            .createdAt(wallet.getCreatedAt())
            .updatedAt(wallet.getUpdatedAt())
            .build();
    }
}
