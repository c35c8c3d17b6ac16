package com.escrowengine.api.dto;

import com.escrowengine.wallet.PaymentMethod;
import com.escrowengine.wallet.PaymentMethodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Payment method as shown to clients. The gateway token stays server side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethodResponse {

    private String id;
    private PaymentMethodType type;
    private String last4;
    private String expiryDate;
    private String name;
    private Boolean isDefault;
    private Instant createdAt;

    public static PaymentMethodResponse from(PaymentMethod method) {
        return PaymentMethodResponse.builder()
            .id(method.getId())
            .type(method.getType())
            .last4(method.getLast4())
            .expiryDate(method.getExpiryDate())
            .name(method.getName())
            .isDefault(method.isDefault())
            .createdAt(method.getCreatedAt())
            .build();
    }
}
