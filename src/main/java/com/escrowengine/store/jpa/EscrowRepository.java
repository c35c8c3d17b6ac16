package com.escrowengine.store.jpa;

import com.escrowengine.escrow.Escrow;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for escrow persistence.
 */
@Repository
public interface EscrowRepository extends JpaRepository<Escrow, String>, JpaSpecificationExecutor<Escrow> {

    Optional<Escrow> findByEscrowId(String escrowId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = JpaLedgerStore.LOCK_TIMEOUT_HINT, value = JpaLedgerStore.LOCK_TIMEOUT_MS))
    @Query("select e from Escrow e where e.escrowId = :escrowId")
    Optional<Escrow> findForUpdateByEscrowId(@Param("escrowId") String escrowId);
}
