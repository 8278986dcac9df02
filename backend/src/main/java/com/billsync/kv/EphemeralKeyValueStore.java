package com.billsync.kv;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Time-boxed key/value storage. A key read after its TTL behaves exactly as if it was never written.
 * No durability is promised beyond the TTL.
 */
public interface EphemeralKeyValueStore {

    /** Name used in logs and configuration. */
    String name();

    /** Emits the value, or completes empty if the key is absent or expired. */
    Mono<byte[]> get(String key);

    Mono<Void> set(String key, byte[] value, Duration ttl);

    Mono<Void> del(String key);

    Mono<Boolean> exists(String key);

    /**
     * Fetches and removes a key. Of two concurrent takes on the same key, at most one emits the value.
     * The default is not atomic; backends override it with their native primitive.
     */
    default Mono<byte[]> take(String key) {
        return get(key).flatMap(value -> del(key).thenReturn(value));
    }
}
