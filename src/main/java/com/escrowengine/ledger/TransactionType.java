package com.escrowengine.ledger;

/**
 * Kinds of balance movement recorded in the transaction log.
 */
public enum TransactionType {
    /**
     * Money paid into a wallet from a payment method. Credit.
     */
    DEPOSIT,

    /**
     * Money paid out of a wallet to a payment method. Debit.
     */
    WITHDRAWAL,

    /**
     * Escrow amount paid to the freelancer. Credit.
     */
    PAYMENT,

    /**
     * Escrow amount returned to the client after a refund or cancellation. Credit.
     */
    REFUND,

    /**
     * Escrow funding: amount plus platform fee taken from the client. Debit.
     */
    ESCROW
}
