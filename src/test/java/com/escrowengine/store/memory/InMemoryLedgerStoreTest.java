package com.escrowengine.store.memory;

import com.escrowengine.common.Currency;
import com.escrowengine.common.Money;
import com.escrowengine.common.exception.StoreException;
import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.ledger.TransactionType;
import com.escrowengine.store.TransactionQuery;
import com.escrowengine.wallet.EscrowReserve;
import com.escrowengine.wallet.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-memory fallback store: atomic commit, rollback and lock timeouts.
 */
class InMemoryLedgerStoreTest {

    private InMemoryLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore(200);
        store.inTransaction(session -> {
            Wallet wallet = new Wallet("alice", Currency.TND);
            wallet.credit(tnd("100.00"));
            session.append(new LedgerEntry("alice", tnd("100.00"), TransactionType.DEPOSIT,
                "pm_1", "Wallet deposit", null, null));
            return session.saveWallet(wallet);
        });
    }

    @Test
    void testCommittedUnitIsVisible() {
        Wallet wallet = store.findWallet("alice").orElseThrow();

        assertEquals(tnd("100.00"), wallet.getBalance());
        assertEquals(0L, wallet.getVersion());
        assertEquals(1, entryCount("alice"));
        assertTrue(store.isHealthy());
        assertEquals(InMemoryLedgerStore.STORE_NAME, store.getStoreName());
    }

    @Test
    void testFailingUnitLeavesNoPartialState() {
        assertThrows(IllegalStateException.class, () -> store.inTransaction(session -> {
            Wallet wallet = session.lockWallet("alice").orElseThrow();
            wallet.debit(tnd("40.00"));
            session.saveWallet(wallet);
            session.append(new LedgerEntry("alice", tnd("-40.00"), TransactionType.WITHDRAWAL,
                "pm_1", "Wallet withdrawal", null, null));
            throw new IllegalStateException("boom");
        }));

        assertEquals(tnd("100.00"), store.findWallet("alice").orElseThrow().getBalance());
        assertEquals(1, entryCount("alice"));
    }

    @Test
    void testInconsistentWalletIsNeverCommitted() {
        assertThrows(IllegalStateException.class, () -> store.inTransaction(session -> {
            Wallet wallet = session.lockWallet("alice").orElseThrow();
            wallet.getEscrowReserves().add(new EscrowReserve("escrow-1", new BigDecimal("500.00")));
            return session.saveWallet(wallet);
        }));

        assertEquals(tnd("0.00"), store.findWallet("alice").orElseThrow().getReservedBalance());
    }

    @Test
    void testReadsReturnCopies() {
        Wallet read = store.findWallet("alice").orElseThrow();
        read.credit(tnd("900.00"));

        assertEquals(tnd("100.00"), store.findWallet("alice").orElseThrow().getBalance());
    }

    @Test
    void testVersionIncreasesOnEveryCommit() {
        store.inTransaction(session -> {
            Wallet wallet = session.lockWallet("alice").orElseThrow();
            wallet.credit(tnd("1.00"));
            return session.saveWallet(wallet);
        });

        assertEquals(1L, store.findWallet("alice").orElseThrow().getVersion());
    }

    @Test
    void testHistoryIsPagedNewestFirst() throws InterruptedException {
        for (int i = 0; i < 3; i++) {
            Thread.sleep(2);
            store.inTransaction(session -> session.append(new LedgerEntry("alice", tnd("1.00"),
                TransactionType.DEPOSIT, "pm_1", "Wallet deposit", null, null)));
        }

        Page<LedgerEntry> page = store.listTransactions(
            TransactionQuery.builder().userId("alice").type(TransactionType.DEPOSIT).build(),
            PageRequest.of(0, 2, Sort.by(Sort.Direction.DESC, "createdAt")));

        assertEquals(4, page.getTotalElements());
        assertEquals(2, page.getContent().size());
        assertFalse(page.getContent().get(0).getCreatedAt()
            .isBefore(page.getContent().get(1).getCreatedAt()));
    }

    @Test
    void testLockTimeoutSurfacesAsStoreException() throws Exception {
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        Future<?> holder = executor.submit(() -> store.inTransaction(session -> {
            inside.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));

        try {
            assertTrue(inside.await(5, TimeUnit.SECONDS));
            StoreException e = assertThrows(StoreException.class, () -> store.findWallet("alice"));
            assertTrue(e.isRetryable());
        } finally {
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            executor.shutdown();
        }
    }

    private int entryCount(String userId) {
        return store.inTransaction(session -> session.findTransactions(userId)).size();
    }

    private static Money tnd(String amount) {
        return Money.of(amount, Currency.TND);
    }
}
