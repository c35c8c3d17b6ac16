package com.escrowengine.wallet;

import com.escrowengine.common.Currency;
import com.escrowengine.common.Money;
import com.escrowengine.common.exception.InsufficientFundsException;
import com.escrowengine.common.exception.NotFoundException;
import com.escrowengine.common.exception.ValidationException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-user wallet.
 *
 * {@code balance} is everything the user owns on the platform. The reserved
 * balance is never stored: it is always the sum of {@link #getEscrowReserves()},
 * and {@code balance - reserved} is what the user may spend or withdraw.
 */
@Entity
@Table(name = "wallets", uniqueConstraints = {
    @UniqueConstraint(name = "uk_wallet_user_id", columnNames = "user_id")
})
@Data
@NoArgsConstructor
public class Wallet {

    @Id
    private String walletId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "balance_amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "balance_currency"))
    })
    private Money balance;

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "wallet_escrow_reserves", joinColumns = @JoinColumn(name = "wallet_id"))
    @OrderColumn(name = "position")
    private List<EscrowReserve> escrowReserves = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "wallet_payment_methods", joinColumns = @JoinColumn(name = "wallet_id"))
    @OrderColumn(name = "position")
    private List<PaymentMethod> paymentMethods = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "wallet_transactions", joinColumns = @JoinColumn(name = "wallet_id"))
    @OrderColumn(name = "position")
    @Column(name = "transaction_id")
    private List<String> transactionIds = new ArrayList<>();

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public Wallet(String userId, Currency currency) {
        this.walletId = UUID.randomUUID().toString();
        this.userId = userId;
        this.balance = Money.zero(currency);
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public Currency getCurrency() {
        return balance.getCurrency();
    }

    public Money getReservedBalance() {
        BigDecimal totalReserved = escrowReserves.stream()
            .map(EscrowReserve::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Money.of(totalReserved, getCurrency());
    }

    public Money getAvailableBalance() {
        return balance.subtract(getReservedBalance());
    }

    public void credit(Money amount) {
        requireSameCurrency(amount);
        this.balance = this.balance.add(amount);
        touch();
    }

    /**
     * Debit the available (unreserved) part of the balance.
     */
    public void debit(Money amount) {
        requireSameCurrency(amount);
        Money available = getAvailableBalance();
        if (available.isLessThan(amount)) {
            throw new InsufficientFundsException(userId, amount, available);
        }
        this.balance = this.balance.subtract(amount);
        touch();
    }

    /**
     * Earmark part of the balance for an escrow. The amount must already be
     * covered by the available balance.
     */
    public void reserve(String escrowId, Money amount) {
        requireSameCurrency(amount);
        if (findReserve(escrowId).isPresent()) {
            throw new IllegalStateException("Escrow already has reserved funds: " + escrowId);
        }
        Money available = getAvailableBalance();
        if (available.isLessThan(amount)) {
            throw new InsufficientFundsException(userId, amount, available);
        }
        escrowReserves.add(new EscrowReserve(escrowId, amount.getAmount()));
        touch();
    }

    /**
     * Drop the reserve entry of an escrow and return the amount it held.
     */
    public Money releaseReserve(String escrowId) {
        EscrowReserve reserve = findReserve(escrowId)
            .orElseThrow(() -> new IllegalStateException("No reserved funds for escrow: " + escrowId));
        escrowReserves.remove(reserve);
        touch();
        return Money.of(reserve.getAmount(), getCurrency());
    }

    public Optional<EscrowReserve> findReserve(String escrowId) {
        return escrowReserves.stream()
            .filter(reserve -> reserve.getEscrowId().equals(escrowId))
            .findFirst();
    }

    public void recordTransaction(String transactionId) {
        transactionIds.add(transactionId);
    }

    public Optional<PaymentMethod> findPaymentMethod(String methodId) {
        return paymentMethods.stream()
            .filter(method -> method.getId().equals(methodId))
            .findFirst();
    }

    public PaymentMethod requirePaymentMethod(String methodId) {
        return findPaymentMethod(methodId)
            .orElseThrow(() -> NotFoundException.paymentMethod(methodId));
    }

    public Optional<PaymentMethod> getDefaultPaymentMethod() {
        return paymentMethods.stream().filter(PaymentMethod::isDefault).findFirst();
    }

    /**
     * Add a method; it becomes the default if asked to or if it is the first one.
     */
    public void addPaymentMethod(PaymentMethod method, boolean makeDefault) {
        boolean becomesDefault = makeDefault || paymentMethods.isEmpty();
        if (becomesDefault) {
            paymentMethods.forEach(existing -> existing.setDefault(false));
        }
        method.setDefault(becomesDefault);
        paymentMethods.add(method);
        touch();
    }

    public void removePaymentMethod(String methodId) {
        PaymentMethod method = requirePaymentMethod(methodId);
        if (paymentMethods.size() == 1) {
            throw new ValidationException("Cannot remove the only payment method");
        }
        paymentMethods.remove(method);
        if (method.isDefault()) {
            paymentMethods.get(0).setDefault(true);
        }
        touch();
    }

    public void setDefaultPaymentMethod(String methodId) {
        requirePaymentMethod(methodId);
        paymentMethods.forEach(method -> method.setDefault(method.getId().equals(methodId)));
        touch();
    }

    /**
     * Balance never negative, reserved never above balance.
     */
    public boolean isConsistent() {
        Money reserved = getReservedBalance();
        return !balance.isNegative() && !reserved.isNegative() && !reserved.isGreaterThan(balance);
    }

    public void assertConsistent() {
        if (!isConsistent()) {
            throw new IllegalStateException(String.format(
                "Wallet of %s would become inconsistent: balance %s, reserved %s",
                userId, balance, getReservedBalance()));
        }
    }

    public Wallet copy() {
        Wallet copy = new Wallet();
        copy.walletId = walletId;
        copy.userId = userId;
        copy.balance = balance;
        copy.escrowReserves = new ArrayList<>();
        escrowReserves.forEach(reserve ->
            copy.escrowReserves.add(new EscrowReserve(reserve.getEscrowId(), reserve.getAmount())));
        copy.paymentMethods = new ArrayList<>();
        paymentMethods.forEach(method -> copy.paymentMethods.add(method.toBuilder().build()));
        copy.transactionIds = new ArrayList<>(transactionIds);
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.version = version;
        return copy;
    }

    private void requireSameCurrency(Money amount) {
        if (amount.getCurrency() != getCurrency()) {
            throw new ValidationException(String.format(
                "Currency mismatch: wallet of %s holds %s, got %s",
                userId, getCurrency(), amount.getCurrency()));
        }
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
