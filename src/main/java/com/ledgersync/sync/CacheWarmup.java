package com.ledgersync.sync;

import com.ledgersync.cache.LedgerCache;
import com.ledgersync.domain.model.Account;
import com.ledgersync.exception.StorageException;
import com.ledgersync.persistence.LedgerStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Hydrates the ledger cache from the last stored account on startup, so reads are served
 * before the first venue session binds. Skipped when the sync worker got there first.
 */
@Component
public class CacheWarmup implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmup.class);

    private final LedgerCache ledgerCache;
    private final LedgerStore ledgerStore;

    public CacheWarmup(LedgerCache ledgerCache, LedgerStore ledgerStore) {
        this.ledgerCache = ledgerCache;
        this.ledgerStore = ledgerStore;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        warmUp();
    }

    public boolean warmUp() {
        if (ledgerCache.isInitialized()) {
            return false;
        }
        try {
            Optional<Account> account = ledgerStore.findDefaultAccount();
            if (account.isEmpty()) {
                log.info("No stored account, cache stays empty until the first venue session");
                return false;
            }
            Account stored = account.get();
            boolean hydrated = ledgerCache.hydrateIfUninitialized(
                    ledgerStore.loadSnapshot(stored.getId(), stored.getBaseCurrency()));
            if (hydrated) {
                log.info("Cache warmed from stored account {}", stored.getExternalAccount());
            }
            return hydrated;
        } catch (StorageException e) {
            // Reads stay empty until the sync worker hydrates on connect
            log.warn("Cache warmup failed: {}", e.getMessage());
            return false;
        }
    }
}
