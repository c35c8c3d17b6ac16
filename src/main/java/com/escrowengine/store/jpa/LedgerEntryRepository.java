package com.escrowengine.store.jpa;

import com.escrowengine.ledger.LedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for transaction log entries.
 */
@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, String>,
        JpaSpecificationExecutor<LedgerEntry> {

    List<LedgerEntry> findByUserIdOrderByCreatedAtAsc(String userId);
}
