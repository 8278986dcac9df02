package com.billsync.kv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local backend. Expiry is passive (checked on every read) plus an active sweep
 * driven by {@link ExpirySweeper} so abandoned keys do not pile up. Values are copied on the way
 * in and on the way out.
 */
public class InMemoryKeyValueStore implements EphemeralKeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private final String name;
    private final Clock clock;
    private final ConcurrentHashMap<String, EphemeralRecord> records = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Mono<byte[]> get(String key) {
        return Mono.fromSupplier(() -> live(key)).map(record -> record.value().clone());
    }

    @Override
    public Mono<Void> set(String key, byte[] value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            Instant expiresAt = clock.instant().plus(ttl);
            records.put(key, new EphemeralRecord(key, value.clone(), expiresAt));
        });
    }

    @Override
    public Mono<Void> del(String key) {
        return Mono.fromRunnable(() -> records.remove(key));
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromSupplier(() -> live(key) != null);
    }

    /** ConcurrentHashMap.remove is the single atomic step: only one caller gets the record back. */
    @Override
    public Mono<byte[]> take(String key) {
        return Mono.fromSupplier(() -> {
            EphemeralRecord removed = records.remove(key);
            if (removed == null || removed.isExpired(clock.instant())) {
                return null;
            }
            return removed.value().clone();
        });
    }

    /**
     * Removes every expired record.
     *
     * @return number of records removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int before = records.size();
        records.values().removeIf(record -> record.isExpired(now));
        int removed = before - records.size();
        if (removed > 0) {
            log.debug("Swept {} expired records from backend '{}'", removed, name);
        }
        return Math.max(removed, 0);
    }

    int size() {
        return records.size();
    }

    private EphemeralRecord live(String key) {
        EphemeralRecord record = records.get(key);
        if (record == null) {
            return null;
        }
        if (record.isExpired(clock.instant())) {
            records.remove(key, record);
            return null;
        }
        return record;
    }
}
