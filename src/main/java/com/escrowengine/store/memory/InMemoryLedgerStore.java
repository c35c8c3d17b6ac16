package com.escrowengine.store.memory;

import com.escrowengine.common.exception.StoreException;
import com.escrowengine.escrow.Escrow;
import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.store.EscrowQuery;
import com.escrowengine.store.LedgerSession;
import com.escrowengine.store.LedgerStore;
import com.escrowengine.store.TransactionQuery;
import com.escrowengine.wallet.Wallet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Ledger store kept entirely in process memory.
 *
 * Used when the database is unreachable, and in tests. Nothing survives a
 * restart. Units of work are serialized by one store-wide write lock and
 * work on private copies of the records they touch; the copies replace the
 * committed records only when the work function returns normally, so an
 * exception anywhere leaves the committed state untouched.
 */
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    public static final String STORE_NAME = "in-memory";

    private final Map<String, Wallet> walletsByUserId = new HashMap<>();
    private final Map<String, Escrow> escrowsById = new HashMap<>();
    private final Map<String, LedgerEntry> entriesById = new LinkedHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final long lockTimeoutMs;

    public InMemoryLedgerStore() {
        this(3000);
    }

    public InMemoryLedgerStore(long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
        log.info("In-memory ledger store initialized: lockTimeoutMs={}", lockTimeoutMs);
    }

    @Override
    public <T> T inTransaction(Function<LedgerSession, T> work) {
        return locked(lock.writeLock(), () -> {
            InMemorySession session = new InMemorySession();
            T result = work.apply(session);
            session.commit();
            return result;
        });
    }

    @Override
    public Optional<Wallet> findWallet(String userId) {
        return locked(lock.readLock(), () -> Optional.ofNullable(walletsByUserId.get(userId)).map(Wallet::copy));
    }

    @Override
    public Optional<Escrow> findEscrow(String escrowId) {
        return locked(lock.readLock(), () -> Optional.ofNullable(escrowsById.get(escrowId)).map(Escrow::copy));
    }

    @Override
    public Optional<LedgerEntry> findTransaction(String transactionId) {
        return locked(lock.readLock(), () -> Optional.ofNullable(entriesById.get(transactionId)));
    }

    @Override
    public Page<Escrow> listEscrows(EscrowQuery query, Pageable pageable) {
        return locked(lock.readLock(), () -> page(
            escrowsById.values().stream().filter(query::matches).map(Escrow::copy).collect(Collectors.toList()),
            Escrow::getCreatedAt, pageable));
    }

    @Override
    public Page<LedgerEntry> listTransactions(TransactionQuery query, Pageable pageable) {
        return locked(lock.readLock(), () -> page(
            entriesById.values().stream().filter(query::matches).collect(Collectors.toList()),
            LedgerEntry::getCreatedAt, pageable));
    }

    @Override
    public String getStoreName() {
        return STORE_NAME;
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    /**
     * Sort by creation time (the only sort property the engine uses), then slice.
     */
    private <T> Page<T> page(List<T> records, Function<T, Instant> createdAt, Pageable pageable) {
        Sort.Order order = pageable.getSort().getOrderFor("createdAt");
        Comparator<T> comparator = Comparator.comparing(createdAt);
        if (order == null || order.isDescending()) {
            comparator = comparator.reversed();
        }
        records.sort(comparator);

        if (pageable.isUnpaged()) {
            return new PageImpl<>(records, pageable, records.size());
        }
        int from = (int) Math.min(pageable.getOffset(), records.size());
        int to = Math.min(from + pageable.getPageSize(), records.size());
        return new PageImpl<>(new ArrayList<>(records.subList(from, to)), pageable, records.size());
    }

    private <T> T locked(Lock target, Supplier<T> operation) {
        boolean acquired;
        try {
            acquired = target.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException(STORE_NAME, "Interrupted while waiting for the store lock", e);
        }
        if (!acquired) {
            log.warn("Timed out after {} ms waiting for the {} store lock", lockTimeoutMs, STORE_NAME);
            throw new StoreException(STORE_NAME,
                "Timed out after " + lockTimeoutMs + " ms waiting for the store lock");
        }
        try {
            return operation.get();
        } finally {
            target.unlock();
        }
    }

    /**
     * Working set of one unit of work. Holds copies; committed maps are only
     * touched in {@link #commit()}.
     */
    private class InMemorySession implements LedgerSession {

        private final Map<String, Wallet> wallets = new LinkedHashMap<>();
        private final Map<String, Escrow> escrows = new LinkedHashMap<>();
        private final List<LedgerEntry> appended = new ArrayList<>();

        @Override
        public Optional<Wallet> lockWallet(String userId) {
            Wallet staged = wallets.get(userId);
            if (staged != null) {
                return Optional.of(staged);
            }
            Optional<Wallet> committed = Optional.ofNullable(walletsByUserId.get(userId)).map(Wallet::copy);
            committed.ifPresent(wallet -> wallets.put(userId, wallet));
            return committed;
        }

        @Override
        public Optional<Escrow> lockEscrow(String escrowId) {
            Escrow staged = escrows.get(escrowId);
            if (staged != null) {
                return Optional.of(staged);
            }
            Optional<Escrow> committed = Optional.ofNullable(escrowsById.get(escrowId)).map(Escrow::copy);
            committed.ifPresent(escrow -> escrows.put(escrowId, escrow));
            return committed;
        }

        @Override
        public Wallet saveWallet(Wallet wallet) {
            wallet.assertConsistent();
            wallets.put(wallet.getUserId(), wallet);
            return wallet;
        }

        @Override
        public Escrow saveEscrow(Escrow escrow) {
            escrows.put(escrow.getEscrowId(), escrow);
            return escrow;
        }

        @Override
        public LedgerEntry append(LedgerEntry entry) {
            if (entriesById.containsKey(entry.getTransactionId())) {
                throw new IllegalStateException("Transaction already recorded: " + entry.getTransactionId());
            }
            appended.add(entry);
            return entry;
        }

        @Override
        public List<LedgerEntry> findTransactions(String userId) {
            List<LedgerEntry> entries = new ArrayList<>();
            entriesById.values().stream()
                .filter(entry -> entry.getUserId().equals(userId))
                .forEach(entries::add);
            appended.stream()
                .filter(entry -> entry.getUserId().equals(userId))
                .forEach(entries::add);
            return entries;
        }

        void commit() {
            wallets.values().forEach(wallet -> {
                wallet.assertConsistent();
                Wallet committed = wallet.copy();
                committed.setVersion(wallet.getVersion() == null ? 0L : wallet.getVersion() + 1);
                walletsByUserId.put(committed.getUserId(), committed);
            });
            escrows.values().forEach(escrow -> {
                Escrow committed = escrow.copy();
                committed.setVersion(escrow.getVersion() == null ? 0L : escrow.getVersion() + 1);
                escrowsById.put(committed.getEscrowId(), committed);
            });
            appended.forEach(entry -> entriesById.put(entry.getTransactionId(), entry));
        }
    }
}
