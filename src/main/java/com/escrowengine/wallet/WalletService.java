package com.escrowengine.wallet;

import com.escrowengine.common.Currency;
import com.escrowengine.common.Money;
import com.escrowengine.common.exception.InsufficientFundsException;
import com.escrowengine.common.exception.StoreException;
import com.escrowengine.common.exception.ValidationException;
import com.escrowengine.gateway.PaymentGateway;
import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.ledger.LedgerService;
import com.escrowengine.ledger.ReconciliationReport;
import com.escrowengine.ledger.TransactionType;
import com.escrowengine.store.LedgerSession;
import com.escrowengine.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Wallet ledger: deposits, withdrawals and payment methods of a single wallet.
 *
 * Every balance change and its transaction log entry are written in one unit
 * of work, and the available balance used to accept a withdrawal is read
 * under the same lock that the debit is written with.
 */
@Service
@Slf4j
public class WalletService {

    private final LedgerStore ledgerStore;
    private final LedgerService ledgerService;
    private final ObjectProvider<PaymentGateway> paymentGateway;
    private final Currency defaultCurrency;

    public WalletService(
            LedgerStore ledgerStore,
            LedgerService ledgerService,
            ObjectProvider<PaymentGateway> paymentGateway,
            @Value("${escrow-engine.wallet.default-currency:TND}") Currency defaultCurrency) {
        this.ledgerStore = ledgerStore;
        this.ledgerService = ledgerService;
        this.paymentGateway = paymentGateway;
        this.defaultCurrency = defaultCurrency;
    }

    /**
     * Get the wallet of a user, creating an empty one on first access.
     */
    public Wallet getOrCreate(String userId) {
        requireUserId(userId);
        Optional<Wallet> existing = ledgerStore.findWallet(userId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return ledgerStore.inTransaction(session -> lockOrCreate(session, userId));
        } catch (StoreException e) {
            // A concurrent first access may have created it in the meantime.
            return ledgerStore.findWallet(userId).orElseThrow(() -> e);
        }
    }

    /**
     * Lock the wallet of a user inside a unit of work, creating it if absent.
     */
    public Wallet lockOrCreate(LedgerSession session, String userId) {
        return session.lockWallet(userId).orElseGet(() -> {
            Wallet wallet = session.saveWallet(new Wallet(userId, defaultCurrency));
            log.info("Created wallet {} for user {} in {}", wallet.getWalletId(), userId, defaultCurrency);
            return wallet;
        });
    }

    public WalletTransactionResult deposit(String userId, BigDecimal amount, String paymentMethodId) {
        requireUserId(userId);
        requirePositive(amount);
        requirePaymentMethodId(paymentMethodId);

        Wallet current = getOrCreate(userId);
        PaymentMethod method = current.requirePaymentMethod(paymentMethodId);
        Money money = Money.of(amount, current.getCurrency());

        String gatewayReference = authorizeCard(method, money);

        try {
            WalletTransactionResult result = ledgerStore.inTransaction(session -> {
                Wallet wallet = lockOrCreate(session, userId);
                wallet.requirePaymentMethod(paymentMethodId);
                wallet.credit(money);
                LedgerEntry entry = ledgerService.record(session, wallet, TransactionType.DEPOSIT, money,
                    paymentMethodId, "Wallet deposit", null, gatewayReference);
                session.saveWallet(wallet);
                return WalletTransactionResult.of(wallet, entry);
            });

            log.info("Deposited {} to wallet of {} via {}: txn={}, balance={}",
                money, userId, paymentMethodId, result.getTransaction().getTransactionId(), result.getNewBalance());
            return result;

        } catch (RuntimeException e) {
            if (gatewayReference != null) {
                log.error("Deposit of {} for {} failed after gateway charge {}; the charge must be reversed",
                    money, userId, gatewayReference, e);
            }
            throw e;
        }
    }

    public WalletTransactionResult withdraw(String userId, BigDecimal amount, String paymentMethodId) {
        requireUserId(userId);
        requirePositive(amount);
        requirePaymentMethodId(paymentMethodId);

        WalletTransactionResult result = ledgerStore.inTransaction(session -> {
            Wallet wallet = lockOrCreate(session, userId);
            Money money = Money.of(amount, wallet.getCurrency());

            Money available = wallet.getAvailableBalance();
            if (money.isGreaterThan(available)) {
                throw new InsufficientFundsException(userId, money, available);
            }
            wallet.requirePaymentMethod(paymentMethodId);

            wallet.debit(money);
            LedgerEntry entry = ledgerService.record(session, wallet, TransactionType.WITHDRAWAL, money.negate(),
                paymentMethodId, "Wallet withdrawal", null, null);
            session.saveWallet(wallet);
            return WalletTransactionResult.of(wallet, entry);
        });

        log.info("Withdrew {} {} from wallet of {} to {}: txn={}, balance={}",
            amount, result.getNewBalance().getCurrency(), userId, paymentMethodId,
            result.getTransaction().getTransactionId(), result.getNewBalance());
        return result;
    }

    public PaymentMethod addPaymentMethod(String userId, PaymentMethodRequest request) {
        requireUserId(userId);
        if (request == null || request.getType() == null) {
            throw new ValidationException("Payment method type is required");
        }
        PaymentMethod method = buildPaymentMethod(request);

        ledgerStore.inTransaction(session -> {
            Wallet wallet = lockOrCreate(session, userId);
            wallet.addPaymentMethod(method, request.isMakeDefault());
            return session.saveWallet(wallet);
        });

        log.info("Added {} payment method {} to wallet of {} (default={})",
            method.getType(), method.getId(), userId, method.isDefault());
        return method;
    }

    public Wallet removePaymentMethod(String userId, String methodId) {
        requireUserId(userId);
        Wallet wallet = ledgerStore.inTransaction(session -> {
            Wallet locked = lockOrCreate(session, userId);
            locked.removePaymentMethod(methodId);
            return session.saveWallet(locked);
        });
        log.info("Removed payment method {} from wallet of {}", methodId, userId);
        return wallet;
    }

    public Wallet setDefaultPaymentMethod(String userId, String methodId) {
        requireUserId(userId);
        Wallet wallet = ledgerStore.inTransaction(session -> {
            Wallet locked = lockOrCreate(session, userId);
            locked.setDefaultPaymentMethod(methodId);
            return session.saveWallet(locked);
        });
        log.info("Payment method {} is now default for wallet of {}", methodId, userId);
        return wallet;
    }

    /**
     * Read-only view of a wallet. A user that never touched the ledger sees an
     * empty wallet in the default currency.
     */
    public Wallet getWallet(String userId) {
        return getOrCreate(userId);
    }

    public Page<LedgerEntry> getHistory(String userId, TransactionType type, int page, int size) {
        return ledgerService.getHistory(userId, type, page, size);
    }

    public ReconciliationReport reconcile(String userId) {
        requireUserId(userId);
        return ledgerStore.inTransaction(session -> ledgerService.reconcile(session, lockOrCreate(session, userId)));
    }

    /**
     * Charge the card through the gateway when the method is a tokenized card
     * and a gateway is configured. Returns the gateway reference, or null when
     * no gateway was involved.
     */
    private String authorizeCard(PaymentMethod method, Money amount) {
        if (!method.getType().isCard() || method.getGatewayToken() == null) {
            return null;
        }
        PaymentGateway gateway = paymentGateway.getIfAvailable();
        if (gateway == null) {
            log.debug("No payment gateway configured, accepting card deposit on {} without authorization",
                method.getId());
            return null;
        }
        String reference = gateway.authorize(method.getGatewayToken(), amount);
        log.info("{} authorized {} on payment method {}: reference={}",
            gateway.getGatewayName(), amount, method.getId(), reference);
        return reference;
    }

    private PaymentMethod buildPaymentMethod(PaymentMethodRequest request) {
        PaymentMethod.PaymentMethodBuilder builder = PaymentMethod.builder()
            .id("pm_" + UUID.randomUUID().toString().replace("-", ""))
            .type(request.getType())
            .name(request.getName() != null && !request.getName().isBlank()
                ? request.getName()
                : request.getType().name().toLowerCase(Locale.ROOT))
            .createdAt(Instant.now());

        if (request.getType().isCard()) {
            String digits = request.getCardNumber() == null ? "" : request.getCardNumber().replaceAll("\\D", "");
            if (digits.length() >= 4) {
                builder.last4(digits.substring(digits.length() - 4));
            }
            if (request.getExpiryMonth() != null && request.getExpiryYear() != null) {
                if (request.getExpiryMonth() < 1 || request.getExpiryMonth() > 12) {
                    throw new ValidationException("Expiry month must be between 1 and 12");
                }
                builder.expiryDate(String.format("%02d/%02d", request.getExpiryMonth(), request.getExpiryYear() % 100));
            }
            builder.gatewayToken(request.getGatewayToken());
        }
        return builder.build();
    }

    private void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User ID is required");
        }
    }

    private void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Valid amount is required");
        }
        if (!Money.hasCentPrecision(amount)) {
            throw new ValidationException("Amount cannot have more than 2 decimal places");
        }
    }

    private void requirePaymentMethodId(String paymentMethodId) {
        if (paymentMethodId == null || paymentMethodId.isBlank()) {
            throw new ValidationException("Payment method ID is required");
        }
    }
}
