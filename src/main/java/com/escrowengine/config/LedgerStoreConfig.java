package com.escrowengine.config;

import com.escrowengine.store.LedgerStore;
import com.escrowengine.store.jpa.JpaLedgerStore;
import com.escrowengine.store.memory.InMemoryLedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Chooses the ledger store the services work against, once, at startup.
 *
 * escrow-engine.store.mode:
 * - JPA    - always the database
 * - MEMORY - always the in-memory store
 * - AUTO   - the database if it answers a connection check, otherwise in-memory
 */
@Configuration
@Slf4j
public class LedgerStoreConfig {

    @Bean
    @Primary
    public LedgerStore ledgerStore(
            JpaLedgerStore jpaLedgerStore,
            @Value("${escrow-engine.store.mode:AUTO}") StoreMode mode,
            @Value("${escrow-engine.store.lock-timeout-ms:3000}") long lockTimeoutMs) {

        LedgerStore selected = switch (mode) {
            case JPA -> jpaLedgerStore;
            case MEMORY -> new InMemoryLedgerStore(lockTimeoutMs);
            case AUTO -> {
                if (jpaLedgerStore.isHealthy()) {
                    yield jpaLedgerStore;
                }
                log.warn("Database unreachable at startup, falling back to the in-memory ledger store. "
                    + "Nothing will be persisted across restarts.");
                yield new InMemoryLedgerStore(lockTimeoutMs);
            }
        };

        log.info("Ledger store selected: mode={}, store={}", mode, selected.getStoreName());
        return selected;
    }

    public enum StoreMode {
        JPA,
        MEMORY,
        AUTO
    }
}
