package com.billsync.onetime;

import com.billsync.kv.EphemeralKeyValueStore;
import com.billsync.protocol.BillSyncException;
import com.billsync.web.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Opaque blobs readable at most once.
 *
 * <p><strong>Destructive read contract:</strong> {@link #consume} removes the secret in the same
 * atomic step that returns it, so a replayed link finds nothing. {@link #peek} only tests existence
 * and never changes what a later {@code consume} sees.
 */
@Service
public class OneTimeSecretService {

    private static final Logger log = LoggerFactory.getLogger(OneTimeSecretService.class);

    static final String KEY_PREFIX = "onetimekey:";

    private final EphemeralKeyValueStore store;
    private final OneTimeSecretProperties properties;

    public OneTimeSecretService(EphemeralKeyValueStore store, OneTimeSecretProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public Mono<String> create(String encryptedPayload) {
        if (encryptedPayload == null || encryptedPayload.isEmpty()) {
            return Mono.error(BillSyncException.invalid("encryptedPayload is required."));
        }
        String keyId = Identifiers.newId();
        return store.set(KEY_PREFIX + keyId, encryptedPayload.getBytes(StandardCharsets.UTF_8), properties.ttl())
                .doOnSuccess(done -> log.info("One-time secret {} created, expires in {}", keyId, properties.ttl()))
                .thenReturn(keyId);
    }

    public Mono<String> consume(String keyId) {
        if (!Identifiers.isWellFormed(keyId)) {
            return Mono.error(BillSyncException.notFound("Invalid or expired key ID."));
        }
        return store.take(KEY_PREFIX + keyId)
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .doOnNext(payload -> log.info("One-time secret {} consumed", keyId))
                .switchIfEmpty(Mono.error(() -> BillSyncException.notFound("Invalid or expired key ID.")));
    }

    /** Completes empty when the secret is still available; errors NOT_FOUND otherwise. */
    public Mono<Void> peek(String keyId) {
        if (!Identifiers.isWellFormed(keyId)) {
            return Mono.error(BillSyncException.notFound("Key not found or already consumed."));
        }
        return store.exists(KEY_PREFIX + keyId)
                .flatMap(present -> present
                        ? Mono.<Void>empty()
                        : Mono.error(BillSyncException.notFound("Key not found or already consumed.")));
    }
}
