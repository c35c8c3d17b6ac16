package com.escrowengine.store.jpa;

import com.escrowengine.wallet.Wallet;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for wallet persistence.
 */
@Repository
public interface WalletRepository extends JpaRepository<Wallet, String> {

    Optional<Wallet> findByUserId(String userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = JpaLedgerStore.LOCK_TIMEOUT_HINT, value = JpaLedgerStore.LOCK_TIMEOUT_MS))
    @Query("select w from Wallet w where w.userId = :userId")
    Optional<Wallet> findForUpdateByUserId(@Param("userId") String userId);
}
