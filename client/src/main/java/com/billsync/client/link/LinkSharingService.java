package com.billsync.client.link;

import com.billsync.client.ClientSettings;
import com.billsync.client.api.ShareApiClient;
import com.billsync.client.crypto.CryptoEngine;
import com.billsync.client.crypto.SealedPayloads;
import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.FailureKind;
import com.billsync.protocol.JsonWebKey;
import com.billsync.protocol.share.ShareChange;
import com.billsync.protocol.share.ShareStatus;
import com.billsync.protocol.share.ShareVersion;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.security.KeyPair;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owner and recipient sides of link sharing.
 *
 * <p>Owner: a bill is signed, sealed under a per-bill content key and stored as a share session.
 * Each participant gets a link whose one-time secret wraps the content key under a fragment key
 * carried only in the URL fragment. Re-sharing updates the session in place; a session that expired
 * or was re-keyed elsewhere is recreated under a fresh id and content key.
 *
 * <p>Recipient: opening a link consumes the one-time secret, so the link works exactly once.
 * The imported bill keeps the content key and can then poll for updates.
 */
public class LinkSharingService {

    private static final Logger log = LoggerFactory.getLogger(LinkSharingService.class);

    static final String LINK_USED = "This share link is invalid or expired. Please ask for a new one.";
    static final String TAMPERED = "Signature verification failed. The bill data may have been tampered with.";

    private final ShareApiClient api;
    private final CryptoEngine crypto;
    private final SealedPayloads sealed;
    private final ObjectMapper objectMapper;
    private final ClientSettings settings;
    private final Clock clock;

    public LinkSharingService(ShareApiClient api,
                              CryptoEngine crypto,
                              ObjectMapper objectMapper,
                              ClientSettings settings,
                              Clock clock) {
        this.api = api;
        this.crypto = crypto;
        this.sealed = new SealedPayloads(crypto, objectMapper);
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.clock = clock;
    }

    // ── Owner ────────────────────────────────────────────────────────────────

    /**
     * Publishes {@code bill} (creating or updating its share session) and returns the link for
     * {@code participantId}. An earlier link for that participant is reused while it is fresh and
     * its one-time key has not been consumed.
     *
     * @param existing the state returned last time, or null for a first share
     */
    public Mono<SharedLink> shareBill(ObjectNode bill, String participantId, OwnerProfile owner,
                                      BillShareState existing) {
        if (!hasParticipant(bill, participantId)) {
            return Mono.error(BillSyncException.invalid("Participant is not on this bill."));
        }
        Mono<BillShareState> published = existing == null
                ? createSession(bill, owner)
                : publishUpdate(existing, bill, owner);
        return published
                .flatMap(state -> participantLink(state, participantId))
                .map(state -> new SharedLink(linkFor(state, participantId), state));
    }

    /**
     * Re-encrypts and updates the existing session, keeping its id. Falls back to
     * {@link #recreateShareSession} when the server reports the session gone or re-keyed.
     */
    public Mono<BillShareState> publishUpdate(BillShareState state, ObjectNode bill, OwnerProfile owner) {
        return Mono.fromCallable(() -> sealBill(bill, owner, crypto.importContentKey(state.contentKey()),
                        crypto.importKeyPair(state.signingKey())))
                .flatMap(ciphertext -> api.updateShare(state.shareId(), ciphertext, state.updateToken()))
                .map(updated -> state.withVersion(updated.version()))
                .doOnNext(updated -> log.debug("Share {} updated to version {}", state.shareId(), updated.version()))
                .onErrorResume(LinkSharingService::sessionLost, e -> {
                    log.warn("Share {} could not be updated ({}); recreating it", state.shareId(),
                            ((BillSyncException) e).kind());
                    return recreateShareSession(state, bill, owner);
                });
    }

    /**
     * New session id and content key, same signing identity. Links issued for the old session stop
     * working and are forgotten.
     */
    public Mono<BillShareState> recreateShareSession(BillShareState previous, ObjectNode bill, OwnerProfile owner) {
        return Mono.fromCallable(() -> crypto.importKeyPair(previous.signingKey()))
                .flatMap(signingKeys -> createSession(bill, owner, signingKeys));
    }

    /** Liveness of each owned share, keyed by share id. */
    public Mono<Map<String, ShareStatus.State>> checkOwnedShares(List<BillShareState> shares) {
        if (shares.isEmpty()) {
            return Mono.just(Map.of());
        }
        return api.batchStatus(shares.stream().map(BillShareState::shareId).toList())
                .map(statuses -> statuses.stream().collect(Collectors.toMap(
                        ShareStatus::shareId, ShareStatus::status, (a, b) -> b, LinkedHashMap::new)));
    }

    // ── Recipient ────────────────────────────────────────────────────────────

    /**
     * Consumes the link's one-time key, decrypts and verifies the bill. A second open of the same
     * link fails NOT_FOUND.
     */
    public Mono<ImportedBill> openLink(String url) {
        return Mono.fromCallable(() -> ShareLink.parse(url, objectMapper))
                .flatMap(link -> api.consumeOneTimeKey(link.keyId())
                        .onErrorMap(LinkSharingService::isNotFound, e -> BillSyncException.notFound(LINK_USED))
                        .map(wrapped -> {
                            SecretKey fragmentKey = crypto.importContentKey(link.fragmentKey());
                            return sealed.open(wrapped, fragmentKey, JsonWebKey.class);
                        })
                        .flatMap(contentKeyJwk -> {
                            SecretKey contentKey = crypto.importContentKey(contentKeyJwk);
                            String participantId = sealed.openText(link.encryptedParticipantId(), contentKey);
                            return api.fetchShare(link.shareId(), null)
                                    .switchIfEmpty(Mono.error(() -> BillSyncException.notFound(LINK_USED)))
                                    .map(snapshot -> new ImportedBill(link.shareId(), contentKeyJwk,
                                            snapshot.version(), participantId,
                                            openVerified(snapshot.ciphertext(), contentKey, null)));
                        }))
                .doOnNext(imported -> log.debug("Imported share {} at version {}", imported.shareId(), imported.version()));
    }

    /** Emits the updated bill, or completes empty when nothing changed. */
    public Mono<ImportedBill> pollForUpdate(ImportedBill imported) {
        return api.fetchShare(imported.shareId(), imported.version())
                .map(snapshot -> imported.withUpdate(
                        openVerified(snapshot.ciphertext(), crypto.importContentKey(imported.contentKey()),
                                imported.payload().publicKey()),
                        snapshot.version()));
    }

    /**
     * One round trip for many imported bills; emits only those that changed. A bill whose update
     * fails to decrypt or verify is skipped and logged, the rest still come through.
     */
    public Flux<ImportedBill> pollImportedBills(List<ImportedBill> imported) {
        if (imported.isEmpty()) {
            return Flux.empty();
        }
        Map<String, ImportedBill> byShareId = imported.stream()
                .collect(Collectors.toMap(ImportedBill::shareId, Function.identity(), (a, b) -> b));
        List<ShareVersion> known = imported.stream()
                .map(bill -> new ShareVersion(bill.shareId(), bill.version()))
                .toList();
        return api.batchCheck(known)
                .flatMapIterable(changes -> changes)
                .filter(change -> byShareId.containsKey(change.shareId()))
                .concatMap(change -> applyChange(byShareId.get(change.shareId()), change));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Mono<BillShareState> createSession(ObjectNode bill, OwnerProfile owner) {
        return Mono.fromCallable(crypto::generateSigningKeyPair)
                .flatMap(signingKeys -> createSession(bill, owner, signingKeys));
    }

    private Mono<BillShareState> createSession(ObjectNode bill, OwnerProfile owner, KeyPair signingKeys) {
        SecretKey contentKey = crypto.generateContentKey();
        return Mono.fromCallable(() -> sealBill(bill, owner, contentKey, signingKeys))
                .flatMap(api::createShare)
                .map(created -> new BillShareState(
                        created.shareId(),
                        crypto.exportKey(contentKey),
                        crypto.exportKey(signingKeys),
                        created.updateToken(),
                        created.version(),
                        Map.of()))
                .doOnNext(state -> log.debug("Share {} created", state.shareId()));
    }

    private Mono<BillShareState> participantLink(BillShareState state, String participantId) {
        Instant now = clock.instant();
        ParticipantLink current = state.participantLinks().get(participantId);
        Mono<Boolean> reusable = current != null && current.isFresh(now)
                ? api.isOneTimeKeyAvailable(current.keyId())
                : Mono.just(false);
        return reusable.flatMap(reuse -> reuse
                ? Mono.just(state)
                : mintParticipantLink(state, participantId, now));
    }

    private Mono<BillShareState> mintParticipantLink(BillShareState state, String participantId, Instant now) {
        SecretKey fragmentKey = crypto.generateContentKey();
        String wrappedContentKey = sealed.seal(state.contentKey(), fragmentKey);
        return api.createOneTimeKey(wrappedContentKey)
                .map(keyId -> state.withParticipantLink(participantId, new ParticipantLink(
                        keyId, crypto.exportKey(fragmentKey), now.plus(settings.participantLinkLifetime()))));
    }

    private String linkFor(BillShareState state, String participantId) {
        ParticipantLink link = state.participantLinks().get(participantId);
        SecretKey contentKey = crypto.importContentKey(state.contentKey());
        String encryptedParticipant = toUrlSafe(sealed.sealText(participantId, contentKey));
        return new ShareLink(state.shareId(), link.keyId(), link.fragmentKey(), encryptedParticipant)
                .toUrl(settings.shareLinkBase(), objectMapper);
    }

    private String sealBill(ObjectNode bill, OwnerProfile owner, SecretKey contentKey, KeyPair signingKeys) {
        JsonNode sanitized = normalized(BillSanitizer.sanitize(bill));
        String signature = crypto.sign(sealed.toJson(sanitized), signingKeys.getPrivate());
        SharedBillPayload payload = new SharedBillPayload(
                sanitized,
                owner.displayName(),
                crypto.exportKey(signingKeys.getPublic()),
                signature,
                owner.paymentDetails());
        return sealed.seal(payload, contentKey);
    }

    /**
     * @param pinnedKey when set, the payload must be signed by this key (updates of an imported bill)
     */
    private SharedBillPayload openVerified(String ciphertext, SecretKey contentKey, JsonWebKey pinnedKey) {
        SharedBillPayload payload = sealed.open(ciphertext, contentKey, SharedBillPayload.class);
        if (payload.bill() == null || payload.publicKey() == null) {
            throw BillSyncException.invalid("Shared bill payload is incomplete.");
        }
        if (pinnedKey != null && !pinnedKey.equals(payload.publicKey())) {
            throw BillSyncException.invalid(TAMPERED);
        }
        boolean verified = crypto.verify(sealed.toJson(normalized(payload.bill())), payload.signature(),
                crypto.importPublicKey(payload.publicKey()));
        if (!verified) {
            throw BillSyncException.invalid(TAMPERED);
        }
        return payload;
    }

    /**
     * The bill as the recipient will parse it. Signing this form keeps the signed text identical on
     * both sides whatever numeric node types the caller built the bill from.
     */
    private JsonNode normalized(JsonNode bill) {
        try {
            return objectMapper.readTree(sealed.toJson(bill));
        } catch (IOException e) {
            throw new IllegalStateException("Bill does not read back as JSON", e);
        }
    }

    private Mono<ImportedBill> applyChange(ImportedBill bill, ShareChange change) {
        return Mono.fromCallable(() -> bill.withUpdate(
                        openVerified(change.ciphertext(), crypto.importContentKey(bill.contentKey()),
                                bill.payload().publicKey()),
                        change.version()))
                .onErrorResume(BillSyncException.class, e -> {
                    log.warn("Skipping update of share {}: {}", change.shareId(), e.getMessage());
                    return Mono.empty();
                });
    }

    private static boolean hasParticipant(JsonNode bill, String participantId) {
        JsonNode participants = bill.path("participants");
        if (participantId == null || !(participants instanceof ArrayNode)) {
            return false;
        }
        for (JsonNode participant : participants) {
            if (participantId.equals(participant.path("id").asText(null))) {
                return true;
            }
        }
        return false;
    }

    private static boolean sessionLost(Throwable e) {
        return e instanceof BillSyncException b
                && (b.kind() == FailureKind.NOT_FOUND || b.kind() == FailureKind.CONFLICT);
    }

    private static boolean isNotFound(Throwable e) {
        return e instanceof BillSyncException b && b.kind() == FailureKind.NOT_FOUND;
    }

    private static String toUrlSafe(String base64) {
        return base64.replace('+', '-').replace('/', '_').replace("=", "");
    }
}
