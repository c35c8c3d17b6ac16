package com.escrowengine.wallet;

/**
 * Kinds of payment method a wallet can be funded from or paid out to.
 */
public enum PaymentMethodType {
    /**
     * Card; deposits are authorized through the payment gateway when a token is present.
     */
    CREDIT_CARD,

    PAYPAL,

    BANK_TRANSFER;

    public boolean isCard() {
        return this == CREDIT_CARD;
    }
}
