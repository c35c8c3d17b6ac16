package com.escrowengine.escrow;

import com.escrowengine.common.Currency;
import com.escrowengine.common.Money;
import com.escrowengine.common.exception.EscrowEngineException;
import com.escrowengine.common.exception.InsufficientFundsException;
import com.escrowengine.common.exception.InvalidEscrowStateException;
import com.escrowengine.common.exception.NotAuthorizedException;
import com.escrowengine.common.exception.NotFoundException;
import com.escrowengine.common.exception.StoreException;
import com.escrowengine.common.exception.ValidationException;
import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.ledger.TransactionType;
import com.escrowengine.wallet.PaymentMethod;
import com.escrowengine.wallet.PaymentMethodRequest;
import com.escrowengine.wallet.PaymentMethodType;
import com.escrowengine.wallet.Wallet;
import com.escrowengine.wallet.WalletService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Page;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the escrow lifecycle against the database store.
 */
@SpringBootTest
@ActiveProfiles("test")
class EscrowServiceTest {

    @Autowired
    private EscrowService escrowService;

    @Autowired
    private WalletService walletService;

    private String clientId;
    private String freelancerId;
    private PaymentMethod clientMethod;

    @BeforeEach
    void setUp() {
        clientId = "client-" + UUID.randomUUID();
        freelancerId = "freelancer-" + UUID.randomUUID();
        clientMethod = walletService.addPaymentMethod(clientId, PaymentMethodRequest.builder()
            .type(PaymentMethodType.BANK_TRANSFER)
            .build());
        walletService.deposit(clientId, new BigDecimal("1000.00"), clientMethod.getId());
    }

    @Test
    void testCreateDebitsTotalAndReservesAmount() {
        EscrowCreationResult result = escrowService.create(request("100.00"));

        assertAmount("5.00", result.getPlatformFee());
        assertAmount("105.00", result.getTotalAmount());

        Escrow escrow = result.getEscrow();
        assertEquals(EscrowStatus.FUNDED, escrow.getStatus());
        assertNotNull(escrow.getFundedAt());
        assertEquals(result.getTransaction().getTransactionId(), escrow.getTransactionId());

        LedgerEntry transaction = result.getTransaction();
        assertEquals(TransactionType.ESCROW, transaction.getType());
        assertAmount("-105.00", transaction.getAmount());
        assertEquals(escrow.getEscrowId(), transaction.getReferenceId());

        Wallet client = walletService.getWallet(clientId);
        assertAmount("895.00", client.getBalance());
        assertAmount("100.00", client.getReservedBalance());
        assertAmount("795.00", client.getAvailableBalance());
        assertTrue(client.findReserve(escrow.getEscrowId()).isPresent());
        assertTrue(walletService.reconcile(clientId).isBalanced());
    }

    @Test
    void testCreateValidation() {
        assertThrows(ValidationException.class, () -> escrowService.create(request("0")));

        CreateEscrowRequest selfDeal = request("10.00");
        selfDeal.setFreelancerId(clientId);
        assertThrows(ValidationException.class, () -> escrowService.create(selfDeal));

        CreateEscrowRequest noService = request("10.00");
        noService.setServiceName(null);
        assertThrows(ValidationException.class, () -> escrowService.create(noService));

        CreateEscrowRequest otherCurrency = request("10.00");
        otherCurrency.setCurrency(Currency.EUR);
        assertThrows(ValidationException.class, () -> escrowService.create(otherCurrency));

        assertAmount("1000.00", walletService.getWallet(clientId).getBalance());
    }

    @Test
    void testCreateRejectsAmountBelowOneCent() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> escrowService.create(request("0.004")));
        assertEquals("Amount cannot have more than 2 decimal places", e.getMessage());
        assertThrows(ValidationException.class, () -> escrowService.create(request("100.001")));

        Wallet client = walletService.getWallet(clientId);
        assertAmount("1000.00", client.getBalance());
        assertTrue(client.getEscrowReserves().isEmpty());
        assertEquals(0, escrowService.listEscrows(clientId, EscrowParty.CLIENT, null, 0, 10).getTotalElements());
    }

    @Test
    void testCreateWithoutFundsForTotal() {
        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> escrowService.create(request("990.00")));

        assertAmount("1000.00", e.getAvailable());
        assertAmount("1039.50", e.getRequested());

        Wallet client = walletService.getWallet(clientId);
        assertAmount("1000.00", client.getBalance());
        assertTrue(client.getEscrowReserves().isEmpty());
    }

    @Test
    void testCreateWithoutFundsForReserve() {
        // 600 + 30 fee fits, but the 600 reserve on top of it does not
        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> escrowService.create(request("600.00")));

        assertAmount("1000.00", e.getAvailable());
        assertAmount("1230.00", e.getRequested());
        assertAmount("1000.00", walletService.getWallet(clientId).getBalance());
    }

    @Test
    void testHappyPathPaysFreelancer() {
        Escrow escrow = escrowService.create(request("100.00")).getEscrow();
        String escrowId = escrow.getEscrowId();

        assertEquals(EscrowStatus.IN_PROGRESS, escrowService.start(escrowId, freelancerId).getStatus());

        Escrow delivered = escrowService.deliver(escrowId, freelancerId, "Done",
            List.of("https://files.example/logo.svg"));
        assertEquals(EscrowStatus.DELIVERED, delivered.getStatus());
        assertEquals(List.of("https://files.example/logo.svg"), delivered.getDeliveryFiles());

        EscrowSettlement settlement = escrowService.approve(escrowId, clientId, 5, "Great work");
        assertEquals(EscrowStatus.APPROVED, settlement.getEscrow().getStatus());
        assertEquals(TransactionType.PAYMENT, settlement.getTransaction().getType());
        assertEquals(freelancerId, settlement.getTransaction().getUserId());
        assertAmount("100.00", settlement.getTransaction().getAmount());

        Escrow approved = escrowService.getEscrow(escrowId);
        assertEquals(EscrowStatus.APPROVED, approved.getStatus());
        assertEquals(5, approved.getApprovalRating());
        assertNotNull(approved.getApprovedAt());

        Wallet client = walletService.getWallet(clientId);
        assertAmount("895.00", client.getBalance());
        assertAmount("0.00", client.getReservedBalance());

        Wallet freelancer = walletService.getWallet(freelancerId);
        assertAmount("100.00", freelancer.getBalance());

        assertTrue(walletService.reconcile(clientId).isBalanced());
        assertTrue(walletService.reconcile(freelancerId).isBalanced());
    }

    @Test
    void testTransitionsCheckCallerThenState() {
        String escrowId = escrowService.create(request("100.00")).getEscrow().getEscrowId();

        assertThrows(NotAuthorizedException.class, () -> escrowService.start(escrowId, clientId));
        assertThrows(NotAuthorizedException.class, () -> escrowService.approve(escrowId, freelancerId, null, null));

        InvalidEscrowStateException e = assertThrows(InvalidEscrowStateException.class,
            () -> escrowService.deliver(escrowId, freelancerId, "Too early", null));
        assertEquals(EscrowStatus.FUNDED, e.getCurrent());
        assertEquals(EscrowStatus.IN_PROGRESS, e.getRequired());

        assertEquals(EscrowStatus.FUNDED, escrowService.getEscrow(escrowId).getStatus());
    }

    @Test
    void testPayloadValidation() {
        String escrowId = escrowService.create(request("100.00")).getEscrow().getEscrowId();
        escrowService.start(escrowId, freelancerId);

        assertThrows(ValidationException.class, () -> escrowService.deliver(escrowId, freelancerId, " ", null));
        escrowService.deliver(escrowId, freelancerId, "Done", null);

        assertThrows(ValidationException.class, () -> escrowService.approve(escrowId, clientId, 6, null));
        assertThrows(ValidationException.class, () -> escrowService.reject(escrowId, clientId, null));
        assertEquals(EscrowStatus.DELIVERED, escrowService.getEscrow(escrowId).getStatus());
    }

    @Test
    void testUnknownEscrow() {
        assertThrows(NotFoundException.class, () -> escrowService.getEscrow("missing"));
        assertThrows(NotFoundException.class, () -> escrowService.start("missing", freelancerId));
    }

    @Test
    void testDisputeRefundedToClient() {
        String escrowId = deliveredEscrow("100.00");

        Escrow disputed = escrowService.reject(escrowId, clientId, "Not what we agreed");
        assertEquals(EscrowStatus.DISPUTED, disputed.getStatus());
        assertAmount("100.00", walletService.getWallet(clientId).getReservedBalance());

        EscrowSettlement settlement = escrowService.resolveDispute(escrowId, "arbiter-1",
            DisputeOutcome.REFUND, "Delivery did not match the brief");

        assertEquals(EscrowStatus.REFUNDED, settlement.getEscrow().getStatus());
        assertEquals(TransactionType.REFUND, settlement.getTransaction().getType());
        assertEquals(clientId, settlement.getTransaction().getUserId());

        Escrow resolved = escrowService.getEscrow(escrowId);
        assertEquals("arbiter-1", resolved.getDisputeResolvedBy());
        assertEquals("Not what we agreed", resolved.getDisputeReason());
        assertNotNull(resolved.getResolvedAt());

        // fee is retained
        Wallet client = walletService.getWallet(clientId);
        assertAmount("995.00", client.getBalance());
        assertAmount("0.00", client.getReservedBalance());
        assertAmount("0.00", walletService.getWallet(freelancerId).getBalance());
        assertTrue(walletService.reconcile(clientId).isBalanced());
    }

    @Test
    void testDisputeReleasedToFreelancer() {
        String escrowId = deliveredEscrow("100.00");
        escrowService.reject(escrowId, clientId, "Late");

        EscrowSettlement settlement = escrowService.resolveDispute(escrowId, "arbiter-1",
            DisputeOutcome.RELEASE, "Delivered as agreed");

        assertEquals(EscrowStatus.RELEASED, settlement.getEscrow().getStatus());
        assertEquals(TransactionType.PAYMENT, settlement.getTransaction().getType());
        assertAmount("100.00", walletService.getWallet(freelancerId).getBalance());
        assertAmount("895.00", walletService.getWallet(clientId).getBalance());
        assertAmount("0.00", walletService.getWallet(clientId).getReservedBalance());

        assertThrows(InvalidEscrowStateException.class, () -> escrowService.resolveDispute(
            escrowId, "arbiter-1", DisputeOutcome.REFUND, "again"));
        assertTrue(walletService.reconcile(freelancerId).isBalanced());
    }

    @Test
    void testPartiesCannotResolveTheirOwnDispute() {
        String escrowId = deliveredEscrow("100.00");
        escrowService.reject(escrowId, clientId, "Not what we agreed");

        assertThrows(NotAuthorizedException.class, () -> escrowService.resolveDispute(
            escrowId, clientId, DisputeOutcome.REFUND, "Refund myself"));
        assertThrows(NotAuthorizedException.class, () -> escrowService.resolveDispute(
            escrowId, freelancerId, DisputeOutcome.RELEASE, "Pay myself"));

        Escrow escrow = escrowService.getEscrow(escrowId);
        assertEquals(EscrowStatus.DISPUTED, escrow.getStatus());
        assertNull(escrow.getDisputeResolvedBy());
        assertAmount("895.00", walletService.getWallet(clientId).getBalance());
        assertAmount("100.00", walletService.getWallet(clientId).getReservedBalance());
        assertAmount("0.00", walletService.getWallet(freelancerId).getBalance());
    }

    @Test
    void testCancelBeforeStart() {
        String escrowId = escrowService.create(request("100.00")).getEscrow().getEscrowId();

        EscrowSettlement settlement = escrowService.cancel(escrowId, clientId, "Changed plans");

        assertEquals(EscrowStatus.CANCELLED, settlement.getEscrow().getStatus());
        assertEquals("Changed plans", settlement.getEscrow().getCancellationReason());
        assertAmount("995.00", walletService.getWallet(clientId).getBalance());
        assertAmount("0.00", walletService.getWallet(clientId).getReservedBalance());
        assertTrue(walletService.reconcile(clientId).isBalanced());
    }

    @Test
    void testCancelAfterStartIsRejected() {
        String escrowId = escrowService.create(request("100.00")).getEscrow().getEscrowId();
        escrowService.start(escrowId, freelancerId);

        assertThrows(NotAuthorizedException.class, () -> escrowService.cancel(escrowId, freelancerId, null));
        assertThrows(InvalidEscrowStateException.class, () -> escrowService.cancel(escrowId, clientId, null));
        assertAmount("100.00", walletService.getWallet(clientId).getReservedBalance());
    }

    @Test
    void testListEscrowsByRoleAndStatus() {
        String first = escrowService.create(request("10.00")).getEscrow().getEscrowId();
        escrowService.create(request("20.00"));
        escrowService.start(first, freelancerId);

        Page<Escrow> asClient = escrowService.listEscrows(clientId, EscrowParty.CLIENT, null, 0, 10);
        assertEquals(2, asClient.getTotalElements());

        Page<Escrow> asFreelancer = escrowService.listEscrows(freelancerId, EscrowParty.FREELANCER, null, 0, 10);
        assertEquals(2, asFreelancer.getTotalElements());

        Page<Escrow> started = escrowService.listEscrows(freelancerId, null, EscrowStatus.IN_PROGRESS, 0, 10);
        assertEquals(1, started.getTotalElements());
        assertEquals(first, started.getContent().get(0).getEscrowId());

        assertEquals(0, escrowService.listEscrows(clientId, EscrowParty.FREELANCER, null, 0, 10)
            .getTotalElements());
        assertThrows(ValidationException.class,
            () -> escrowService.listEscrows(clientId, EscrowParty.ARBITER, null, 0, 10));
    }

    @Test
    void testConcurrentApprovalsPayOnce() throws InterruptedException {
        String escrowId = deliveredEscrow("100.00");
        int threadCount = 2;

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        List<Throwable> failures = new ArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    escrowService.approve(escrowId, clientId, null, null);
                    successCount.incrementAndGet();
                } catch (Throwable t) {
                    synchronized (failures) {
                        failures.add(t);
                    }
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, successCount.get());
        assertEquals(1, failures.size());
        Throwable loser = failures.get(0);
        assertTrue(loser instanceof EscrowEngineException, () -> "unexpected failure: " + loser);
        assertTrue(((EscrowEngineException) loser).isRetryable());

        assertAmount("100.00", walletService.getWallet(freelancerId).getBalance());
        assertAmount("895.00", walletService.getWallet(clientId).getBalance());
        assertAmount("0.00", walletService.getWallet(clientId).getReservedBalance());
        assertTrue(walletService.reconcile(freelancerId).isBalanced());
    }

    @Test
    void testWithdrawRacingCreateKeepsReserveCovered() throws InterruptedException {
        // Each fits alone (615 or 500 of 1000 available), not both.
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(2);
        AtomicInteger successCount = new AtomicInteger(0);
        List<Throwable> failures = new ArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Runnable> operations = List.of(
            () -> escrowService.create(request("300.00")),
            () -> walletService.withdraw(clientId, new BigDecimal("500.00"), clientMethod.getId()));
        for (Runnable operation : operations) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    operation.run();
                    successCount.incrementAndGet();
                } catch (Throwable t) {
                    synchronized (failures) {
                        failures.add(t);
                    }
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, successCount.get());
        assertEquals(1, failures.size());
        Throwable loser = failures.get(0);
        assertTrue(loser instanceof InsufficientFundsException || loser instanceof StoreException,
            () -> "unexpected failure: " + loser);

        Wallet client = walletService.getWallet(clientId);
        assertFalse(client.getReservedBalance().isGreaterThan(client.getBalance()));
        assertTrue(client.isConsistent());
        if (client.getEscrowReserves().isEmpty()) {
            assertAmount("500.00", client.getBalance());
        } else {
            assertAmount("685.00", client.getBalance());
            assertAmount("300.00", client.getReservedBalance());
        }
        assertTrue(walletService.reconcile(clientId).isBalanced());
    }

    private String deliveredEscrow(String amount) {
        String escrowId = escrowService.create(request(amount)).getEscrow().getEscrowId();
        escrowService.start(escrowId, freelancerId);
        escrowService.deliver(escrowId, freelancerId, "Done", null);
        return escrowId;
    }

    private CreateEscrowRequest request(String amount) {
        return CreateEscrowRequest.builder()
            .clientId(clientId)
            .freelancerId(freelancerId)
            .serviceName("Logo design")
            .description("Vector logo in three colours")
            .amount(new BigDecimal(amount))
            .currency(Currency.TND)
            .paymentMethodId(clientMethod.getId())
            .terms("Two revisions")
            .build();
    }

    private static void assertAmount(String expected, Money actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual.getAmount()),
            () -> "expected " + expected + " but was " + actual);
    }
}
