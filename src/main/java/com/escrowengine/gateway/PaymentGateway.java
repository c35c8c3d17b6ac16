package com.escrowengine.gateway;

import com.escrowengine.common.Money;

/**
 * Card payment gateway consulted when a wallet is funded from a card.
 *
 * In production this would wrap a card processor such as Stripe or Adyen.
 * The engine never sees card numbers, only the token the gateway issued.
 */
public interface PaymentGateway {

    /**
     * Authorize and capture {@code amount} on the tokenized card.
     *
     * @param cardToken gateway token of the card
     * @param amount amount to charge
     * @return the gateway's reference for the charge
     * @throws com.escrowengine.common.exception.PaymentDeclinedException if the charge is refused
     */
    String authorize(String cardToken, Money amount);

    /**
     * Get the gateway name, used for logging.
     */
    String getGatewayName();
}
