package com.escrowengine.api.controller;

import com.escrowengine.api.dto.AddPaymentMethodRequest;
import com.escrowengine.api.dto.PaymentMethodResponse;
import com.escrowengine.api.dto.WalletResponse;
import com.escrowengine.api.dto.WalletTransactionRequest;
import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.ledger.ReconciliationReport;
import com.escrowengine.ledger.TransactionType;
import com.escrowengine.wallet.PaymentMethod;
import com.escrowengine.wallet.WalletService;
import com.escrowengine.wallet.WalletTransactionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for wallets, their payment methods and transaction history.
 */
@RestController
@RequestMapping("/api/v1/wallets")
@RequiredArgsConstructor
@Tag(name = "Wallets", description = "Wallet ledger API")
public class WalletController {

    private final WalletService walletService;

    @GetMapping("/{userId}")
    @Operation(summary = "Get a user's wallet, creating it on first access")
    public ResponseEntity<WalletResponse> getWallet(@PathVariable String userId) {
        return ResponseEntity.ok(WalletResponse.from(walletService.getWallet(userId)));
    }

    @PostMapping("/{userId}/payment-methods")
    @Operation(summary = "Add a payment method")
    public ResponseEntity<PaymentMethodResponse> addPaymentMethod(
            @PathVariable String userId,
            @Valid @RequestBody AddPaymentMethodRequest request) {
        PaymentMethod method = walletService.addPaymentMethod(userId, request.toPaymentMethodRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentMethodResponse.from(method));
    }

    @DeleteMapping("/{userId}/payment-methods/{methodId}")
    @Operation(summary = "Remove a payment method")
    public ResponseEntity<WalletResponse> removePaymentMethod(
            @PathVariable String userId,
            @PathVariable String methodId) {
        return ResponseEntity.ok(WalletResponse.from(walletService.removePaymentMethod(userId, methodId)));
    }

    @PutMapping("/{userId}/payment-methods/{methodId}/default")
    @Operation(summary = "Make a payment method the default")
    public ResponseEntity<WalletResponse> setDefaultPaymentMethod(
            @PathVariable String userId,
            @PathVariable String methodId) {
        return ResponseEntity.ok(WalletResponse.from(walletService.setDefaultPaymentMethod(userId, methodId)));
    }

    @PostMapping("/{userId}/deposit")
    @Operation(summary = "Deposit funds from a payment method")
    public ResponseEntity<WalletTransactionResult> deposit(
            @PathVariable String userId,
            @Valid @RequestBody WalletTransactionRequest request) {
        return ResponseEntity.ok(walletService.deposit(userId, request.getAmount(), request.getPaymentMethodId()));
    }

    @PostMapping("/{userId}/withdraw")
    @Operation(summary = "Withdraw available funds to a payment method")
    public ResponseEntity<WalletTransactionResult> withdraw(
            @PathVariable String userId,
            @Valid @RequestBody WalletTransactionRequest request) {
        return ResponseEntity.ok(walletService.withdraw(userId, request.getAmount(), request.getPaymentMethodId()));
    }

    @GetMapping("/{userId}/transactions")
    @Operation(summary = "Get transaction history, newest first")
    public ResponseEntity<Page<LedgerEntry>> getTransactions(
            @PathVariable String userId,
            @RequestParam(required = false) TransactionType type,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(walletService.getHistory(userId, type, page, size));
    }

    @GetMapping("/{userId}/reconciliation")
    @Operation(summary = "Compare the wallet balance with the sum of its ledger entries")
    public ResponseEntity<ReconciliationReport> reconcile(@PathVariable String userId) {
        return ResponseEntity.ok(walletService.reconcile(userId));
    }
}
