package com.billsync.kv;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Active expiry for in-memory backends. Cassandra expires rows on its own.
 */
@Component
public class ExpirySweeper {

    private final ShardedKeyValueStore store;

    public ExpirySweeper(ShardedKeyValueStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${billsync.kv.sweep-interval:PT1M}")
    public int sweep() {
        int removed = 0;
        for (EphemeralKeyValueStore backend : store.backends()) {
            if (backend instanceof InMemoryKeyValueStore memory) {
                removed += memory.sweepExpired();
            }
        }
        return removed;
    }
}
