package com.escrowengine.store;

import com.escrowengine.escrow.Escrow;
import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.wallet.Wallet;

import java.util.List;
import java.util.Optional;

/**
 * Handle to one open unit of work, only valid inside
 * {@link LedgerStore#inTransaction(java.util.function.Function)}.
 *
 * Records returned by the {@code lock*} methods cannot be changed by any other
 * unit of work until this one ends, so decisions taken on them hold at commit.
 */
public interface LedgerSession {

    Optional<Wallet> lockWallet(String userId);

    Optional<Escrow> lockEscrow(String escrowId);

    Wallet saveWallet(Wallet wallet);

    Escrow saveEscrow(Escrow escrow);

    /**
     * Append an entry to the transaction log. Entries are written once.
     */
    LedgerEntry append(LedgerEntry entry);

    /**
     * Every entry of a user, oldest first, including those appended by this
     * unit of work. Complete as long as the user's wallet is locked.
     */
    List<LedgerEntry> findTransactions(String userId);
}
