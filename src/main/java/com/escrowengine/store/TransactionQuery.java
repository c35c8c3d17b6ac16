package com.escrowengine.store;

import com.escrowengine.ledger.LedgerEntry;
import com.escrowengine.ledger.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filter for a user's transaction history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionQuery {

    private String userId;

    /**
     * Null matches every type.
     */
    private TransactionType type;

    public boolean matches(LedgerEntry entry) {
        return userId.equals(entry.getUserId()) && (type == null || type == entry.getType());
    }
}
