package com.escrowengine.wallet;

import com.escrowengine.common.Currency;
import com.escrowengine.common.Money;
import com.escrowengine.common.exception.InsufficientFundsException;
import com.escrowengine.common.exception.NotFoundException;
import com.escrowengine.common.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for wallet balance and payment method bookkeeping.
 */
class WalletTest {

    private Wallet wallet;

    @BeforeEach
    void setUp() {
        wallet = new Wallet("user-1", Currency.TND);
        wallet.credit(tnd("1000.00"));
    }

    @Test
    void testReserveReducesAvailableButNotBalance() {
        wallet.reserve("escrow-1", tnd("100.00"));

        assertEquals(tnd("1000.00"), wallet.getBalance());
        assertEquals(tnd("100.00"), wallet.getReservedBalance());
        assertEquals(tnd("900.00"), wallet.getAvailableBalance());
        assertTrue(wallet.isConsistent());
    }

    @Test
    void testDebitCannotTouchReservedFunds() {
        wallet.reserve("escrow-1", tnd("600.00"));

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> wallet.debit(tnd("500.00")));

        assertEquals(tnd("400.00"), e.getAvailable());
        assertEquals(tnd("500.00"), e.getRequested());
        assertEquals(tnd("1000.00"), wallet.getBalance());
    }

    @Test
    void testReleaseReserveReturnsHeldAmount() {
        wallet.reserve("escrow-1", tnd("100.00"));
        wallet.reserve("escrow-2", tnd("50.00"));

        Money released = wallet.releaseReserve("escrow-1");

        assertEquals(tnd("100.00"), released);
        assertEquals(tnd("50.00"), wallet.getReservedBalance());
        assertTrue(wallet.findReserve("escrow-1").isEmpty());
    }

    @Test
    void testEscrowCannotBeReservedTwice() {
        wallet.reserve("escrow-1", tnd("100.00"));

        assertThrows(IllegalStateException.class, () -> wallet.reserve("escrow-1", tnd("10.00")));
        assertThrows(IllegalStateException.class, () -> wallet.releaseReserve("escrow-unknown"));
    }

    @Test
    void testCurrencyMismatchIsRejected() {
        assertThrows(ValidationException.class, () -> wallet.credit(Money.of("5.00", Currency.EUR)));
    }

    @Test
    void testFirstPaymentMethodBecomesDefault() {
        wallet.addPaymentMethod(method("pm_1"), false);
        wallet.addPaymentMethod(method("pm_2"), false);

        assertEquals("pm_1", wallet.getDefaultPaymentMethod().orElseThrow().getId());
    }

    @Test
    void testMakeDefaultClearsPreviousDefault() {
        wallet.addPaymentMethod(method("pm_1"), false);
        wallet.addPaymentMethod(method("pm_2"), true);

        assertEquals(1, wallet.getPaymentMethods().stream().filter(PaymentMethod::isDefault).count());
        assertEquals("pm_2", wallet.getDefaultPaymentMethod().orElseThrow().getId());

        wallet.setDefaultPaymentMethod("pm_1");
        assertEquals("pm_1", wallet.getDefaultPaymentMethod().orElseThrow().getId());
        assertEquals(1, wallet.getPaymentMethods().stream().filter(PaymentMethod::isDefault).count());
    }

    @Test
    void testRemovingDefaultPromotesAnother() {
        wallet.addPaymentMethod(method("pm_1"), false);
        wallet.addPaymentMethod(method("pm_2"), false);

        wallet.removePaymentMethod("pm_1");

        assertEquals(1, wallet.getPaymentMethods().size());
        assertTrue(wallet.getPaymentMethods().get(0).isDefault());
    }

    @Test
    void testOnlyPaymentMethodCannotBeRemoved() {
        wallet.addPaymentMethod(method("pm_1"), false);

        ValidationException e = assertThrows(ValidationException.class, () -> wallet.removePaymentMethod("pm_1"));
        assertEquals("Cannot remove the only payment method", e.getMessage());
        assertThrows(NotFoundException.class, () -> wallet.removePaymentMethod("pm_missing"));
    }

    @Test
    void testCopyIsIndependent() {
        wallet.addPaymentMethod(method("pm_1"), false);
        wallet.reserve("escrow-1", tnd("10.00"));

        Wallet copy = wallet.copy();
        copy.releaseReserve("escrow-1");
        copy.getPaymentMethods().get(0).setDefault(false);

        assertEquals(tnd("10.00"), wallet.getReservedBalance());
        assertTrue(wallet.getPaymentMethods().get(0).isDefault());
    }

    private static Money tnd(String amount) {
        return Money.of(amount, Currency.TND);
    }

    private static PaymentMethod method(String id) {
        return PaymentMethod.builder()
            .id(id)
            .type(PaymentMethodType.BANK_TRANSFER)
            .name("bank")
            .createdAt(Instant.now())
            .build();
    }
}
