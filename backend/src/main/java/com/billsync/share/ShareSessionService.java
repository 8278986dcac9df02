package com.billsync.share;

import com.billsync.kv.EphemeralKeyValueStore;
import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.share.ShareChange;
import com.billsync.protocol.share.ShareCreated;
import com.billsync.protocol.share.ShareSnapshot;
import com.billsync.protocol.share.ShareStatus;
import com.billsync.protocol.share.ShareUpdated;
import com.billsync.protocol.share.ShareVersion;
import com.billsync.web.Identifiers;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Versioned ciphertext behind a re-shareable bill link.
 *
 * <p>Every write resets the TTL. {@code version} is epoch millis, bumped past the previous
 * version when two writes land in the same millisecond, so a conditional fetch with the
 * version a client already holds is always answered "not modified". Updates of one share run
 * one after another within this process, so each one reads the version the previous one wrote.
 */
@Service
public class ShareSessionService {

    private static final Logger log = LoggerFactory.getLogger(ShareSessionService.class);

    static final String KEY_PREFIX = "share:";

    private static final String GONE = "Share session not found or expired.";

    private final EphemeralKeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ShareSessionProperties properties;

    /** Completion signal of the most recent update per share id; absent when none is pending. */
    private final ConcurrentHashMap<String, Mono<Void>> pendingUpdates = new ConcurrentHashMap<>();

    public ShareSessionService(EphemeralKeyValueStore store,
                               ObjectMapper objectMapper,
                               Clock clock,
                               ShareSessionProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
    }

    public Mono<ShareCreated> create(String ciphertext) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            return Mono.error(BillSyncException.invalid("ciphertext is required."));
        }
        String shareId = Identifiers.newId();
        StoredShareSession session = new StoredShareSession(ciphertext, clock.millis(), Identifiers.newId());
        return write(shareId, session)
                .doOnSuccess(done -> log.info("Share session {} created at version {}", shareId, session.version()))
                .thenReturn(new ShareCreated(shareId, session.version(), session.updateToken()));
    }

    /**
     * Replaces the ciphertext. NOT_FOUND when the session expired (the owner must recreate);
     * CONFLICT when the token does not match (the session was re-keyed elsewhere).
     */
    public Mono<ShareUpdated> update(String shareId, String ciphertext, String updateToken) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            return Mono.error(BillSyncException.invalid("ciphertext is required."));
        }
        if (updateToken == null || updateToken.isEmpty()) {
            return Mono.error(BillSyncException.invalid("updateToken is required."));
        }
        return oneAtATime(shareId, read(shareId)
                .switchIfEmpty(Mono.error(() -> BillSyncException.notFound(GONE)))
                .flatMap(current -> {
                    if (!tokensMatch(current.updateToken(), updateToken)) {
                        return Mono.error(BillSyncException.conflict(
                                "Share session was updated from another device; recreate it."));
                    }
                    long version = Math.max(clock.millis(), current.version() + 1);
                    StoredShareSession next = new StoredShareSession(ciphertext, version, current.updateToken());
                    return write(shareId, next)
                            .doOnSuccess(done -> log.info("Share session {} updated to version {}", shareId, version))
                            .thenReturn(new ShareUpdated(shareId, version));
                }));
    }

    /**
     * Subscribes to {@code work} only once the previous update of the same share has terminated
     * in any way, cancellation included.
     */
    private <T> Mono<T> oneAtATime(String shareId, Mono<T> work) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            Mono<Void> turn = done.asMono();
            Mono<Void> previous = pendingUpdates.put(shareId, turn);
            Mono<Void> wait = previous == null ? Mono.empty() : previous;
            return wait.then(work)
                    .doFinally(signal -> {
                        pendingUpdates.remove(shareId, turn);
                        done.tryEmitEmpty();
                    });
        });
    }

    /**
     * Emits the snapshot, completes empty when {@code ifNewerThan} is at or past the stored
     * version, or errors NOT_FOUND.
     */
    public Mono<ShareSnapshot> fetch(String shareId, Long ifNewerThan) {
        return read(shareId)
                .switchIfEmpty(Mono.error(() -> BillSyncException.notFound(GONE)))
                .filter(session -> ifNewerThan == null || session.version() > ifNewerThan)
                .map(session -> new ShareSnapshot(session.ciphertext(), session.version()));
    }

    public Flux<ShareStatus> statuses(List<String> shareIds) {
        return checkBatch(shareIds)
                .thenMany(Flux.defer(() -> Flux.fromIterable(shareIds)))
                .concatMap(shareId -> exists(shareId)
                        .map(live -> new ShareStatus(shareId, live ? ShareStatus.State.LIVE : ShareStatus.State.EXPIRED)));
    }

    /**
     * Only sessions whose stored version is newer than the caller's; expired ones are left out.
     */
    public Flux<ShareChange> changedSince(List<ShareVersion> known) {
        return checkBatch(known)
                .thenMany(Flux.defer(() -> Flux.fromIterable(known)))
                .concatMap(entry -> read(entry.shareId())
                        .filter(session -> session.version() > entry.version())
                        .map(session -> new ShareChange(entry.shareId(), session.ciphertext(), session.version())));
    }

    // ── Store access ──

    private Mono<Boolean> exists(String shareId) {
        if (!Identifiers.isWellFormed(shareId)) {
            return Mono.just(false);
        }
        return store.exists(KEY_PREFIX + shareId);
    }

    private Mono<StoredShareSession> read(String shareId) {
        if (!Identifiers.isWellFormed(shareId)) {
            return Mono.empty();
        }
        return store.get(KEY_PREFIX + shareId)
                .map(bytes -> {
                    try {
                        return objectMapper.readValue(bytes, StoredShareSession.class);
                    } catch (IOException e) {
                        throw BillSyncException.transport("Stored share session " + shareId + " is unreadable", e);
                    }
                });
    }

    private Mono<Void> write(String shareId, StoredShareSession session) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsBytes(session))
                .flatMap(bytes -> store.set(KEY_PREFIX + shareId, bytes, properties.ttl()));
    }

    private Mono<Void> checkBatch(List<?> entries) {
        if (entries == null) {
            return Mono.error(BillSyncException.invalid("A list of share sessions is required."));
        }
        if (entries.size() > properties.maxBatchSize()) {
            return Mono.error(BillSyncException.invalid(
                    "At most " + properties.maxBatchSize() + " share sessions per request."));
        }
        return Mono.empty();
    }

    private static boolean tokensMatch(String expected, String presented) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
