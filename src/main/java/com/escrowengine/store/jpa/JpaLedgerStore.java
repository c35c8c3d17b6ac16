package com.escrowengine.store.jpa;

import com.escrowengine.common.exception.StoreException;
import com.escrowengine.escrow.Escrow;
import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.store.EscrowQuery;
import com.escrowengine.store.LedgerSession;
import com.escrowengine.store.LedgerStore;
import com.escrowengine.store.TransactionQuery;
import com.escrowengine.wallet.Wallet;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Ledger store backed by the relational database through Spring Data JPA.
 *
 * Each unit of work is one database transaction. Records read through the
 * session are row-locked ({@code SELECT ... FOR UPDATE}) for the rest of the
 * transaction; {@code @Version} columns on wallets and escrows catch anything
 * written without a lock. Lock waits, deadlocks, version conflicts and
 * transaction timeouts all surface as {@link StoreException} after rollback.
 */
@Component
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    public static final String STORE_NAME = "jpa";

    static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";
    static final String LOCK_TIMEOUT_MS = "3000";

    private final WalletRepository walletRepository;
    private final EscrowRepository escrowRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final DataSource dataSource;
    private final TransactionTemplate transactionTemplate;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaLedgerStore(
            WalletRepository walletRepository,
            EscrowRepository escrowRepository,
            LedgerEntryRepository ledgerEntryRepository,
            DataSource dataSource,
            PlatformTransactionManager transactionManager,
            @Value("${escrow-engine.store.transaction-timeout-seconds:10}") int transactionTimeoutSeconds) {

        this.walletRepository = walletRepository;
        this.escrowRepository = escrowRepository;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.dataSource = dataSource;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(transactionTimeoutSeconds);
    }

    @Override
    public <T> T inTransaction(Function<LedgerSession, T> work) {
        return translate("Unit of work aborted",
            () -> transactionTemplate.execute(status -> work.apply(new JpaLedgerSession())));
    }

    @Override
    public Optional<Wallet> findWallet(String userId) {
        return translate("Failed to read wallet", () -> walletRepository.findByUserId(userId));
    }

    @Override
    public Optional<Escrow> findEscrow(String escrowId) {
        return translate("Failed to read escrow", () -> escrowRepository.findByEscrowId(escrowId));
    }

    @Override
    public Optional<LedgerEntry> findTransaction(String transactionId) {
        return translate("Failed to read transaction", () -> ledgerEntryRepository.findById(transactionId));
    }

    @Override
    public Page<Escrow> listEscrows(EscrowQuery query, Pageable pageable) {
        return translate("Failed to list escrows",
            () -> escrowRepository.findAll(escrowSpecification(query), pageable));
    }

    @Override
    public Page<LedgerEntry> listTransactions(TransactionQuery query, Pageable pageable) {
        Specification<LedgerEntry> spec = (root, cq, cb) -> query.getType() == null
            ? cb.equal(root.get("userId"), query.getUserId())
            : cb.and(cb.equal(root.get("userId"), query.getUserId()),
                     cb.equal(root.get("type"), query.getType()));
        return translate("Failed to list transactions", () -> ledgerEntryRepository.findAll(spec, pageable));
    }

    @Override
    public String getStoreName() {
        return STORE_NAME;
    }

    @Override
    public boolean isHealthy() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private Specification<Escrow> escrowSpecification(EscrowQuery query) {
        return (root, cq, cb) -> {
            Predicate client = cb.equal(root.get("clientId"), query.getUserId());
            Predicate freelancer = cb.equal(root.get("freelancerId"), query.getUserId());
            Predicate party = query.getRole() == null
                ? cb.or(client, freelancer)
                : switch (query.getRole()) {
                    case CLIENT -> client;
                    case FREELANCER -> freelancer;
                    case ARBITER -> cb.disjunction();
                };
            return query.getStatus() == null
                ? party
                : cb.and(party, cb.equal(root.get("status"), query.getStatus()));
        };
    }

    private <T> T translate(String message, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            log.warn("{} in {} store: {}", message, STORE_NAME, e.getMessage());
            throw new StoreException(STORE_NAME, message + ": " + e.getMessage(), e);
        }
    }

    /**
     * Session bound to the surrounding Spring-managed transaction.
     */
    private class JpaLedgerSession implements LedgerSession {

        @Override
        public Optional<Wallet> lockWallet(String userId) {
            return walletRepository.findForUpdateByUserId(userId);
        }

        @Override
        public Optional<Escrow> lockEscrow(String escrowId) {
            return escrowRepository.findForUpdateByEscrowId(escrowId);
        }

        @Override
        public Wallet saveWallet(Wallet wallet) {
            wallet.assertConsistent();
            return walletRepository.save(wallet);
        }

        @Override
        public Escrow saveEscrow(Escrow escrow) {
            return escrowRepository.save(escrow);
        }

        @Override
        public LedgerEntry append(LedgerEntry entry) {
            entityManager.persist(entry);
            return entry;
        }

        @Override
        public List<LedgerEntry> findTransactions(String userId) {
            return ledgerEntryRepository.findByUserIdOrderByCreatedAtAsc(userId);
        }
    }
}
