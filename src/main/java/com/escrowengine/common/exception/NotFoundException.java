package com.escrowengine.common.exception;

/**
 * Thrown when a wallet, escrow, payment method or ledger entry does not exist.
 */
public class NotFoundException extends EscrowEngineException {

    private final String resource;
    private final String resourceId;

    public NotFoundException(String resource, String resourceId) {
        super(resource + " not found: " + resourceId);
        this.resource = resource;
        this.resourceId = resourceId;
    }

    public static NotFoundException escrow(String escrowId) {
        return new NotFoundException("Escrow", escrowId);
    }

    public static NotFoundException wallet(String userId) {
        return new NotFoundException("Wallet", userId);
    }

    public static NotFoundException paymentMethod(String methodId) {
        return new NotFoundException("Payment method", methodId);
    }

    public static NotFoundException transaction(String transactionId) {
        return new NotFoundException("Transaction", transactionId);
    }

    public String getResource() {
        return resource;
    }

    public String getResourceId() {
        return resourceId;
    }
}
