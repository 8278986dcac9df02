package com.billsync.share;

import com.billsync.protocol.ErrorResponse;
import com.billsync.protocol.share.BatchStatusRequest;
import com.billsync.protocol.share.ShareChange;
import com.billsync.protocol.share.ShareCreated;
import com.billsync.protocol.share.ShareRequest;
import com.billsync.protocol.share.ShareSnapshot;
import com.billsync.protocol.share.ShareStatus;
import com.billsync.protocol.share.ShareUpdated;
import com.billsync.protocol.share.ShareVersion;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * HTTP-layer tests for /share against a real embedded Netty server and in-memory backends.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ShareSessionControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    // ── Helpers ───────────────────────────────────────────────────────────────

    private ShareCreated create(String ciphertext) {
        ShareCreated created = webTestClient.post()
                .uri("/share")
                .bodyValue(ShareRequest.create(ciphertext))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(ShareCreated.class)
                .returnResult()
                .getResponseBody();
        assertNotNull(created);
        return created;
    }

    private ShareUpdated update(ShareCreated created, String ciphertext) {
        return webTestClient.post()
                .uri("/share/{id}", created.shareId())
                .bodyValue(new ShareRequest(ciphertext, created.updateToken()))
                .exchange()
                .expectStatus().isOk()
                .expectBody(ShareUpdated.class)
                .returnResult()
                .getResponseBody();
    }

    // ── POST /share, GET /share/{id} ──────────────────────────────────────────

    @Test
    void fetchShouldReturnSnapshotWithNoStore() {
        ShareCreated created = create("C1");

        webTestClient.get()
                .uri("/share/{id}", created.shareId())
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(HttpHeaders.CACHE_CONTROL, "no-store")
                .expectBody(ShareSnapshot.class)
                .value(snapshot -> {
                    assertEquals("C1", snapshot.ciphertext());
                    assertEquals(created.version(), snapshot.version());
                });
    }

    @Test
    void conditionalFetchShouldAnswer304AtCurrentVersion() {
        ShareCreated created = create("C1");
        ShareUpdated updated = update(created, "C2");

        webTestClient.get()
                .uri(b -> b.path("/share/{id}").queryParam("ifNewerThan", updated.version()).build(created.shareId()))
                .exchange()
                .expectStatus().isNotModified()
                .expectBody().isEmpty();

        webTestClient.get()
                .uri(b -> b.path("/share/{id}").queryParam("ifNewerThan", updated.version() - 1).build(created.shareId()))
                .exchange()
                .expectStatus().isOk()
                .expectBody(ShareSnapshot.class)
                .value(snapshot -> assertEquals("C2", snapshot.ciphertext()));
    }

    @Test
    void unknownSessionShouldBe404() {
        webTestClient.get()
                .uri("/share/{id}", UUID.randomUUID())
                .exchange()
                .expectStatus().isNotFound()
                .expectBody(ErrorResponse.class)
                .value(error -> assertEquals("Share session not found or expired.", error.message()));

        webTestClient.post()
                .uri("/share/{id}", UUID.randomUUID())
                .bodyValue(new ShareRequest("C2", UUID.randomUUID().toString()))
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void wrongUpdateTokenShouldBe409() {
        ShareCreated created = create("C1");

        webTestClient.post()
                .uri("/share/{id}", created.shareId())
                .bodyValue(new ShareRequest("C2", UUID.randomUUID().toString()))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody(ErrorResponse.class)
                .value(error -> assertEquals("CONFLICT", error.code()));
    }

    @Test
    void malformedIfNewerThanShouldBe400() {
        ShareCreated created = create("C1");

        webTestClient.get()
                .uri("/share/{id}?ifNewerThan=yesterday", created.shareId())
                .exchange()
                .expectStatus().isBadRequest();
    }

    // ── Batch ─────────────────────────────────────────────────────────────────

    @Test
    void batchStatusShouldReportEachSession() {
        ShareCreated live = create("C1");
        String expired = UUID.randomUUID().toString();

        webTestClient.post()
                .uri("/share/batch-status")
                .bodyValue(new BatchStatusRequest(List.of(live.shareId(), expired)))
                .exchange()
                .expectStatus().isOk()
                .expectBodyList(ShareStatus.class)
                .value(statuses -> {
                    assertEquals(2, statuses.size());
                    assertEquals(ShareStatus.State.LIVE, statuses.get(0).status());
                    assertEquals(ShareStatus.State.EXPIRED, statuses.get(1).status());
                });
    }

    @Test
    void batchCheckShouldReturnOnlyUpdatedSessions() {
        ShareCreated stale = create("A1");
        ShareCreated fresh = create("B1");
        update(stale, "A2");

        webTestClient.post()
                .uri("/share/batch-check")
                .bodyValue(List.of(
                        new ShareVersion(stale.shareId(), stale.version()),
                        new ShareVersion(fresh.shareId(), fresh.version())))
                .exchange()
                .expectStatus().isOk()
                .expectBodyList(ShareChange.class)
                .value(changes -> {
                    assertEquals(1, changes.size());
                    assertEquals(stale.shareId(), changes.get(0).shareId());
                    assertEquals("A2", changes.get(0).ciphertext());
                    assertTrue(changes.get(0).version() > stale.version());
                });
    }
}
