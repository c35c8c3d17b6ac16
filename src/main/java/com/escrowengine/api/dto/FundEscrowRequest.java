package com.escrowengine.api.dto;

import com.escrowengine.common.Currency;
import com.escrowengine.escrow.CreateEscrowRequest;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * DTO for creating an escrow funded from the client's wallet.
 */
@Data
public class FundEscrowRequest {

    @NotBlank(message = "Client ID is required")
    private String clientId;

    @NotBlank(message = "Freelancer ID is required")
    private String freelancerId;

    private String serviceId;

    @NotBlank(message = "Service name is required")
    private String serviceName;

    @NotBlank(message = "Description is required")
    private String description;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than zero")
    @Digits(integer = 17, fraction = 2, message = "Amount cannot have more than 2 decimal places")
    private BigDecimal amount;

    /**
     * Defaults to the client wallet's currency.
     */
    private Currency currency;

    @NotBlank(message = "Payment method ID is required")
    private String paymentMethodId;

    private String terms;

    private Instant expiresAt;

    public CreateEscrowRequest toCreateEscrowRequest() {
        return CreateEscrowRequest.builder()
            .clientId(clientId)
            .freelancerId(freelancerId)
            .serviceId(serviceId)
            .serviceName(serviceName)
            .description(description)
            .amount(amount)
            .currency(currency)
            .paymentMethodId(paymentMethodId)
            .terms(terms)
            .expiresAt(expiresAt)
            .build();
    }
}
