package com.escrowengine.escrow;

import com.escrowengine.common.Currency;
import com.escrowengine.common.Money;
import com.escrowengine.common.exception.InvalidEscrowStateException;
import com.escrowengine.common.exception.NotAuthorizedException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Funds-in-trust agreement between a client and a freelancer.
 *
 * The escrow never holds money itself: while it is open, its amount sits as a
 * reserve entry on the client's wallet. Status only changes through
 * {@link #apply(EscrowAction)}.
 */
@Entity
@Table(name = "escrows", indexes = {
    @Index(name = "idx_escrow_client_status", columnList = "client_id, status"),
    @Index(name = "idx_escrow_freelancer_status", columnList = "freelancer_id, status"),
    @Index(name = "idx_escrow_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class Escrow {

    @Id
    private String escrowId;

    @Column(name = "client_id", nullable = false)
    private String clientId;

    @Column(name = "freelancer_id", nullable = false)
    private String freelancerId;

    private String serviceId;

    private String serviceName;

    @Column(length = 4000)
    private String description;

    /**
     * What the freelancer receives on approval.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "currency"))
    })
    private Money amount;

    /**
     * Charged on top of the amount at funding time; kept by the platform.
     */
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "platform_fee")),
        @AttributeOverride(name = "currency", column = @Column(name = "platform_fee_currency"))
    })
    private Money platformFee;

    private String paymentMethodId;

    /**
     * Ledger entry that funded this escrow.
     */
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private EscrowStatus status;

    @Column(length = 4000)
    private String terms;

    private Instant expiresAt;

    @Column(name = "created_at")
    private Instant createdAt;

    private Instant fundedAt;
    private Instant startedAt;
    private Instant deliveredAt;
    private Instant approvedAt;
    private Instant disputedAt;
    private Instant resolvedAt;

    @Column(length = 4000)
    private String deliveryMessage;

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "escrow_delivery_files", joinColumns = @JoinColumn(name = "escrow_id"))
    @OrderColumn(name = "position")
    @Column(name = "file_url")
    private List<String> deliveryFiles = new ArrayList<>();

    private Integer approvalRating;

    @Column(length = 4000)
    private String approvalFeedback;

    @Column(length = 4000)
    private String disputeReason;

    @Column(length = 4000)
    private String disputeResolution;

    private String disputeResolvedBy;

    @Column(length = 4000)
    private String cancellationReason;

    @Version
    private Long version;

    public Escrow(String clientId, String freelancerId, String serviceId, String serviceName,
                  String description, Money amount, Money platformFee, String paymentMethodId,
                  String terms, Instant expiresAt) {
        this.escrowId = UUID.randomUUID().toString();
        this.clientId = clientId;
        this.freelancerId = freelancerId;
        this.serviceId = serviceId;
        this.serviceName = serviceName;
        this.description = description;
        this.amount = amount;
        this.platformFee = platformFee;
        this.paymentMethodId = paymentMethodId;
        this.terms = terms;
        this.expiresAt = expiresAt;
        this.status = EscrowStatus.CREATED;
        this.createdAt = Instant.now();
    }

    public Currency getCurrency() {
        return amount.getCurrency();
    }

    /**
     * Amount plus platform fee, i.e. what funding debits from the client.
     */
    public Money getTotal() {
        return amount.add(platformFee);
    }

    public void markFunded(String fundingTransactionId) {
        if (status != EscrowStatus.CREATED) {
            throw new InvalidEscrowStateException(escrowId, status, EscrowStatus.CREATED);
        }
        this.transactionId = fundingTransactionId;
        this.status = EscrowStatus.FUNDED;
        this.fundedAt = Instant.now();
    }

    /**
     * Check that {@code callerId} is the party the action belongs to.
     * Arbiter actions accept any non-blank caller outside the escrow itself.
     */
    public void authorize(EscrowAction action, String callerId) {
        boolean allowed = switch (action.getParty()) {
            case CLIENT -> clientId.equals(callerId);
            case FREELANCER -> freelancerId.equals(callerId);
            case ARBITER -> callerId != null && !callerId.isBlank()
                && !clientId.equals(callerId) && !freelancerId.equals(callerId);
        };
        if (!allowed) {
            throw new NotAuthorizedException(callerId, action.getVerb(), escrowId);
        }
    }

    /**
     * Move to the action's target status and stamp the matching timestamp.
     *
     * @throws InvalidEscrowStateException if the escrow is not in the action's required status
     */
    public void apply(EscrowAction action) {
        if (status != action.getRequiredStatus()) {
            throw new InvalidEscrowStateException(escrowId, status, action.getRequiredStatus());
        }
        Instant now = Instant.now();
        switch (action) {
            case START -> this.startedAt = now;
            case DELIVER -> this.deliveredAt = now;
            case APPROVE -> this.approvedAt = now;
            case REJECT -> this.disputedAt = now;
            case CANCEL, REFUND, RELEASE -> this.resolvedAt = now;
        }
        this.status = action.getTargetStatus();
    }

    public Escrow copy() {
        Escrow copy = new Escrow();
        copy.escrowId = escrowId;
        copy.clientId = clientId;
        copy.freelancerId = freelancerId;
        copy.serviceId = serviceId;
        copy.serviceName = serviceName;
        copy.description = description;
        copy.amount = amount;
        copy.platformFee = platformFee;
        copy.paymentMethodId = paymentMethodId;
        copy.transactionId = transactionId;
        copy.status = status;
        copy.terms = terms;
        copy.expiresAt = expiresAt;
        copy.createdAt = createdAt;
        copy.fundedAt = fundedAt;
        copy.startedAt = startedAt;
        copy.deliveredAt = deliveredAt;
        copy.approvedAt = approvedAt;
        copy.disputedAt = disputedAt;
        copy.resolvedAt = resolvedAt;
        copy.deliveryMessage = deliveryMessage;
        copy.deliveryFiles = new ArrayList<>(deliveryFiles);
        copy.approvalRating = approvalRating;
        copy.approvalFeedback = approvalFeedback;
        copy.disputeReason = disputeReason;
        copy.disputeResolution = disputeResolution;
        copy.disputeResolvedBy = disputeResolvedBy;
        copy.cancellationReason = cancellationReason;
        copy.version = version;
        return copy;
    }
}
