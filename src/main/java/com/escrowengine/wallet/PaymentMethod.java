package com.escrowengine.wallet;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Payment method registered on a wallet.
 */
@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethod {

    @Column(name = "method_id", nullable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "method_type", nullable = false)
    private PaymentMethodType type;

    private String last4;

    /**
     * Card expiry as MM/YY.
     */
    private String expiryDate;

    private String name;

    @Column(name = "is_default")
    private boolean isDefault;

    /**
     * Token the payment gateway knows this card by. Never the card number.
     */
    private String gatewayToken;

    @Column(name = "method_created_at")
    private Instant createdAt;
}
