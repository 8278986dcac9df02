package com.billsync.client.api;

import com.billsync.client.ClientSettings;
import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.ErrorResponse;
import com.billsync.protocol.FailureKind;
import com.billsync.protocol.onetime.OneTimeKeyCreated;
import com.billsync.protocol.onetime.OneTimeKeyPayload;
import com.billsync.protocol.onetime.OneTimeKeyRequest;
import com.billsync.protocol.onetime.OneTimeKeyStatus;
import com.billsync.protocol.share.BatchStatusRequest;
import com.billsync.protocol.share.ShareChange;
import com.billsync.protocol.share.ShareCreated;
import com.billsync.protocol.share.ShareRequest;
import com.billsync.protocol.share.ShareSnapshot;
import com.billsync.protocol.share.ShareStatus;
import com.billsync.protocol.share.ShareUpdated;
import com.billsync.protocol.share.ShareVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * HTTP client for the share-session and one-time key endpoints. Every failure leaves this class as a
 * {@link BillSyncException}: 404 is NOT_FOUND, 409 CONFLICT, other 4xx VALIDATION_FAILURE, and
 * 5xx, timeouts and connection errors TRANSPORT_FAILURE.
 */
public class ShareApiClient {

    private static final Logger log = LoggerFactory.getLogger(ShareApiClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    public ShareApiClient(ClientSettings settings) {
        this(WebClient.builder().baseUrl(settings.apiBaseUrl().toString()).build(), settings.requestTimeout());
    }

    public ShareApiClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    // ── Share sessions ───────────────────────────────────────────────────────

    public Mono<ShareCreated> createShare(String ciphertext) {
        return call(webClient.post().uri("/share")
                .bodyValue(ShareRequest.create(ciphertext))
                .retrieve()
                .onStatus(HttpStatusCode::isError, ShareApiClient::toException)
                .bodyToMono(ShareCreated.class));
    }

    public Mono<ShareUpdated> updateShare(String shareId, String ciphertext, String updateToken) {
        return call(webClient.post().uri("/share/{id}", shareId)
                .bodyValue(new ShareRequest(ciphertext, updateToken))
                .retrieve()
                .onStatus(HttpStatusCode::isError, ShareApiClient::toException)
                .bodyToMono(ShareUpdated.class));
    }

    /**
     * Completes empty on 304, i.e. when {@code ifNewerThan} already covers the stored version.
     */
    public Mono<ShareSnapshot> fetchShare(String shareId, Long ifNewerThan) {
        return call(webClient.get()
                .uri(builder -> {
                    builder.path("/share/{id}");
                    if (ifNewerThan != null) {
                        builder.queryParam("ifNewerThan", ifNewerThan);
                    }
                    return builder.build(shareId);
                })
                .<ShareSnapshot>exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NOT_MODIFIED.value()) {
                        return response.releaseBody().then(Mono.<ShareSnapshot>empty());
                    }
                    if (response.statusCode().isError()) {
                        return toException(response).flatMap(Mono::<ShareSnapshot>error);
                    }
                    return response.bodyToMono(ShareSnapshot.class);
                }));
    }

    public Mono<List<ShareStatus>> batchStatus(List<String> shareIds) {
        return call(webClient.post().uri("/share/batch-status")
                .bodyValue(new BatchStatusRequest(shareIds))
                .retrieve()
                .onStatus(HttpStatusCode::isError, ShareApiClient::toException)
                .bodyToMono(new ParameterizedTypeReference<List<ShareStatus>>() {}));
    }

    public Mono<List<ShareChange>> batchCheck(List<ShareVersion> known) {
        return call(webClient.post().uri("/share/batch-check")
                .bodyValue(known)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ShareApiClient::toException)
                .bodyToMono(new ParameterizedTypeReference<List<ShareChange>>() {}));
    }

    // ── One-time keys ────────────────────────────────────────────────────────

    public Mono<String> createOneTimeKey(String encryptedPayload) {
        return call(webClient.post().uri("/onetime-key")
                .bodyValue(new OneTimeKeyRequest(encryptedPayload))
                .retrieve()
                .onStatus(HttpStatusCode::isError, ShareApiClient::toException)
                .bodyToMono(OneTimeKeyCreated.class)
                .map(OneTimeKeyCreated::keyId));
    }

    /** DESTRUCTIVE: a second call for the same id fails NOT_FOUND. */
    public Mono<String> consumeOneTimeKey(String keyId) {
        return call(webClient.get().uri("/onetime-key/{id}", keyId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ShareApiClient::toException)
                .bodyToMono(OneTimeKeyPayload.class)
                .map(OneTimeKeyPayload::encryptedPayload));
    }

    /** True while the secret is unconsumed and unexpired; a 404 is answered with false. */
    public Mono<Boolean> isOneTimeKeyAvailable(String keyId) {
        return call(webClient.get().uri("/onetime-key/{id}/status", keyId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, ShareApiClient::toException)
                .bodyToMono(OneTimeKeyStatus.class)
                .map(OneTimeKeyStatus::isAvailable))
                .onErrorResume(e -> e instanceof BillSyncException b && b.kind() == FailureKind.NOT_FOUND,
                        e -> Mono.just(false));
    }

    // ── Error mapping ────────────────────────────────────────────────────────

    private <T> Mono<T> call(Mono<T> request) {
        return request
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof BillSyncException), e -> {
                    log.warn("Server call failed: {}", e.toString());
                    return BillSyncException.transport("Could not reach the server. Please try again.", e);
                });
    }

    static Mono<Throwable> toException(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        return response.bodyToMono(ErrorResponse.class)
                .onErrorResume(e -> {
                    log.debug("Error body of a {} response was unreadable: {}", status.value(), e.toString());
                    return Mono.empty();
                })
                .mapNotNull(ErrorResponse::message)
                .defaultIfEmpty("Server answered " + status.value() + ".")
                .map(message -> exceptionFor(status, message));
    }

    static BillSyncException exceptionFor(HttpStatusCode status, String message) {
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            return BillSyncException.notFound(message);
        }
        if (status.value() == HttpStatus.CONFLICT.value()) {
            return BillSyncException.conflict(message);
        }
        if (status.is4xxClientError()) {
            return BillSyncException.invalid(message);
        }
        return BillSyncException.transport(message, null);
    }
}
