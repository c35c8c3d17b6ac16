package com.escrowengine.escrow;

import com.escrowengine.common.Currency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Request to create and fund an escrow from the client's wallet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateEscrowRequest {

    private String clientId;
    private String freelancerId;
    private String serviceId;
    private String serviceName;
    private String description;
    private BigDecimal amount;
    private Currency currency;
    private String paymentMethodId;
    private String terms;
    private Instant expiresAt;
}
