package com.billsync.kv;

import com.billsync.protocol.BillSyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Federates several independent backends for availability.
 *
 * <p><strong>Writes</strong> ({@code set}, {@code del}, {@code take}) go to exactly one backend,
 * chosen by a stable hash of the key, so every key has a single writer-of-record. A write that
 * cannot reach that backend fails.
 *
 * <p><strong>Reads</strong> ({@code get}, {@code exists}) query every backend concurrently and take
 * the first affirmative answer. A backend error counts as "no answer", not as "key missing":
 * a read only comes back empty when every backend is either empty or failing.
 */
public class ShardedKeyValueStore implements EphemeralKeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(ShardedKeyValueStore.class);

    private final List<EphemeralKeyValueStore> backends;

    public ShardedKeyValueStore(List<EphemeralKeyValueStore> backends) {
        if (backends.isEmpty()) {
            throw new IllegalArgumentException("At least one key/value backend is required");
        }
        this.backends = List.copyOf(backends);
    }

    @Override
    public String name() {
        return "sharded";
    }

    public List<EphemeralKeyValueStore> backends() {
        return backends;
    }

    @Override
    public Mono<byte[]> get(String key) {
        return Flux.merge(backends.stream()
                        .map(backend -> backend.get(key).onErrorResume(e -> noAnswer(backend, "get", e)))
                        .toList())
                .next();
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Flux.merge(backends.stream()
                        .map(backend -> backend.exists(key).onErrorResume(e -> noAnswer(backend, "exists", e)))
                        .toList())
                .filter(Boolean::booleanValue)
                .next()
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Void> set(String key, byte[] value, Duration ttl) {
        EphemeralKeyValueStore owner = ownerOf(key);
        return owner.set(key, value, ttl).onErrorMap(e -> unavailable(owner, e));
    }

    @Override
    public Mono<Void> del(String key) {
        EphemeralKeyValueStore owner = ownerOf(key);
        return owner.del(key).onErrorMap(e -> unavailable(owner, e));
    }

    @Override
    public Mono<byte[]> take(String key) {
        EphemeralKeyValueStore owner = ownerOf(key);
        return owner.take(key).onErrorMap(e -> unavailable(owner, e));
    }

    EphemeralKeyValueStore ownerOf(String key) {
        return backends.get(shardIndex(key, backends.size()));
    }

    /**
     * String.hashCode read as unsigned 32 bits, modulo the backend count. This is the same
     * 31-multiplier hash the browser build used, so both pick the same shard for a key.
     */
    static int shardIndex(String key, int shardCount) {
        return (int) (Integer.toUnsignedLong(key.hashCode()) % shardCount);
    }

    private <T> Mono<T> noAnswer(EphemeralKeyValueStore backend, String operation, Throwable error) {
        log.warn("Backend '{}' failed on {}; treating as no answer: {}", backend.name(), operation, error.toString());
        return Mono.empty();
    }

    private static Throwable unavailable(EphemeralKeyValueStore backend, Throwable error) {
        if (error instanceof BillSyncException) {
            return error;
        }
        return BillSyncException.transport("Storage backend '" + backend.name() + "' is unavailable", error);
    }
}
