package com.escrowengine.ledger;

import com.escrowengine.common.Money;
import com.escrowengine.common.exception.NotFoundException;
import com.escrowengine.common.exception.ValidationException;
import com.escrowengine.store.LedgerSession;
import com.escrowengine.store.LedgerStore;
import com.escrowengine.store.TransactionQuery;
import com.escrowengine.wallet.Wallet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Transaction log: the append-only record of every balance movement.
 *
 * Entries are only written through {@link #record}, which must run inside the
 * same unit of work as the wallet change it describes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    static final int MAX_PAGE_SIZE = 100;

    private final LedgerStore ledgerStore;

    /**
     * Append an entry for a movement on {@code wallet} and link it from the wallet.
     * The caller still saves the wallet.
     */
    public LedgerEntry record(LedgerSession session, Wallet wallet, TransactionType type, Money amount,
                              String paymentMethodId, String description, String referenceId,
                              String gatewayReference) {
        LedgerEntry entry = session.append(new LedgerEntry(
            wallet.getUserId(),
            amount,
            type,
            paymentMethodId,
            description,
            referenceId,
            gatewayReference
        ));
        wallet.recordTransaction(entry.getTransactionId());

        log.debug("Appended {}: txn={}, user={}, amount={}, ref={}",
            type, entry.getTransactionId(), wallet.getUserId(), amount, referenceId);
        return entry;
    }

    public LedgerEntry getTransaction(String transactionId) {
        return ledgerStore.findTransaction(transactionId)
            .orElseThrow(() -> NotFoundException.transaction(transactionId));
    }

    /**
     * Transaction history of a user, newest first.
     *
     * @param type optional filter
     * @param page zero-based page index
     */
    public Page<LedgerEntry> getHistory(String userId, TransactionType type, int page, int size) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User ID is required");
        }
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("Page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        TransactionQuery query = TransactionQuery.builder().userId(userId).type(type).build();
        return ledgerStore.listTransactions(query,
            PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    /**
     * Check that the wallet balance equals the sum of the user's entries.
     * The wallet must be locked in {@code session} so that no movement commits
     * between reading the balance and reading the entries.
     */
    public ReconciliationReport reconcile(LedgerSession session, Wallet wallet) {
        List<LedgerEntry> entries = session.findTransactions(wallet.getUserId());
        Money total = entries.stream()
            .map(LedgerEntry::getAmount)
            .reduce(Money.zero(wallet.getCurrency()), Money::add);

        ReconciliationReport report = ReconciliationReport.builder()
            .userId(wallet.getUserId())
            .walletBalance(wallet.getBalance())
            .ledgerTotal(total)
            .difference(wallet.getBalance().subtract(total))
            .entryCount(entries.size())
            .build();

        if (!report.isBalanced()) {
            log.error("Reconciliation mismatch for {}: wallet balance {}, ledger total {}",
                wallet.getUserId(), wallet.getBalance(), total);
        }
        return report;
    }
}
