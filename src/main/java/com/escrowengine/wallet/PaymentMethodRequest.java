package com.escrowengine.wallet;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Details of a payment method to register on a wallet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethodRequest {

    private PaymentMethodType type;

    /**
     * Full card number; only the last four digits are kept.
     */
    private String cardNumber;

    private Integer expiryMonth;

    private Integer expiryYear;

    private String name;

    private boolean makeDefault;

    /**
     * Token issued by the payment gateway for this card.
     */
    private String gatewayToken;
}
