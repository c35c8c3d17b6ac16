package com.escrowengine.ledger;

import com.escrowengine.common.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable transaction log entry.
 *
 * The amount is signed: positive entries credit the user's wallet, negative
 * entries debit it. Summing all entries of a user gives the wallet balance.
 * Entries are never updated or deleted.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_user_type", columnList = "user_id, transaction_type"),
    @Index(name = "idx_ledger_reference", columnList = "reference_id"),
    @Index(name = "idx_ledger_created_at", columnList = "created_at")
})
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEntry {

    @Id
    private String transactionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", updatable = false)),
        @AttributeOverride(name = "currency", column = @Column(name = "currency", updatable = false))
    })
    private Money amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private TransactionStatus status;

    @Column(updatable = false)
    private String paymentMethodId;

    @Column(updatable = false)
    private String description;

    /**
     * Escrow this movement belongs to, if any.
     */
    @Column(name = "reference_id", updatable = false)
    private String referenceId;

    /**
     * Authorization reference returned by the payment gateway for card deposits.
     */
    @Column(updatable = false)
    private String gatewayReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(String userId, Money amount, TransactionType type, String paymentMethodId,
                       String description, String referenceId, String gatewayReference) {
        this.transactionId = UUID.randomUUID().toString();
        this.userId = userId;
        this.amount = amount;
        this.type = type;
        this.status = TransactionStatus.COMPLETED;
        this.paymentMethodId = paymentMethodId;
        this.description = description;
        this.referenceId = referenceId;
        this.gatewayReference = gatewayReference;
        this.createdAt = Instant.now();
    }
}
