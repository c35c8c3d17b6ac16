package com.escrowengine.store;

import com.escrowengine.escrow.Escrow;
import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.wallet.Wallet;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.Optional;
import java.util.function.Function;

/**
 * Storage for wallets, escrows and transaction log entries.
 *
 * Reads outside {@link #inTransaction(Function)} see committed state only and
 * must not be used to decide whether money may move. Everything that mutates
 * records goes through {@code inTransaction}: all writes made through the
 * {@link LedgerSession} commit together, or none of them do.
 *
 * Implementations:
 * - {@link com.escrowengine.store.jpa.JpaLedgerStore} - durable, relational database
 * - {@link com.escrowengine.store.memory.InMemoryLedgerStore} - fallback, lost on restart
 */
public interface LedgerStore {

    /**
     * Run {@code work} as one atomic unit of work.
     *
     * Exceptions thrown by {@code work} roll the unit back and propagate unchanged.
     *
     * @return whatever {@code work} returned, after a successful commit
     * @throws com.escrowengine.common.exception.StoreException if the unit of work
     *         conflicted with a concurrent commit, timed out, or could not commit
     */
    <T> T inTransaction(Function<LedgerSession, T> work);

    /**
     * Look a wallet up by its unique user identifier.
     */
    Optional<Wallet> findWallet(String userId);

    Optional<Escrow> findEscrow(String escrowId);

    Optional<LedgerEntry> findTransaction(String transactionId);

    Page<Escrow> listEscrows(EscrowQuery query, Pageable pageable);

    Page<LedgerEntry> listTransactions(TransactionQuery query, Pageable pageable);

    /**
     * Name used in logs and errors, e.g. "jpa" or "in-memory".
     */
    String getStoreName();

    /**
     * Whether the backing storage is reachable.
     */
    boolean isHealthy();
}
