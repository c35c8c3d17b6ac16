package com.escrowengine.common.exception;

/**
 * Thrown when a unit of work against the ledger store aborts, conflicts with a
 * concurrent commit, or times out. Nothing of the unit of work was committed.
 */
public class StoreException extends EscrowEngineException {

    private final String storeName;

    public StoreException(String storeName, String message, Throwable cause) {
        super(message, cause);
        this.storeName = storeName;
    }

    public StoreException(String storeName, String message) {
        super(message);
        this.storeName = storeName;
    }

    public String getStoreName() {
        return storeName;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
