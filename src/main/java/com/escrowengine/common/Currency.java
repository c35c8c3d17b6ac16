package com.escrowengine.common;

/**
 * Supported wallet currencies.
 * Amounts in different currencies are never converted into each other.
 */
public enum Currency {
    TND,
    USD,
    EUR,
    GBP
}
