package com.escrowengine.api.dto;

import com.escrowengine.wallet.PaymentMethodRequest;
import com.escrowengine.wallet.PaymentMethodType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for registering a payment method on a wallet.
 */
@Data
public class AddPaymentMethodRequest {

    @NotNull(message = "Payment method type is required")
    private PaymentMethodType type;

    private String cardNumber;

    @Min(value = 1, message = "Expiry month must be between 1 and 12")
    @Max(value = 12, message = "Expiry month must be between 1 and 12")
    private Integer expiryMonth;

    private Integer expiryYear;

    private String name;

    private Boolean isDefault;

    private String gatewayToken;

    public PaymentMethodRequest toPaymentMethodRequest() {
        return PaymentMethodRequest.builder()
            .type(type)
            .cardNumber(cardNumber)
            .expiryMonth(expiryMonth)
            .expiryYear(expiryYear)
            .name(name)
            .makeDefault(Boolean.TRUE.equals(isDefault))
            .gatewayToken(gatewayToken)
            .build();
    }
}
