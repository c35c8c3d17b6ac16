package com.escrowengine.ledger;

/**
 * Status of a transaction log entry.
 * The engine only writes {@link #COMPLETED} entries; the others exist for
 * entries imported from external processors.
 */
public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REFUNDED
}
