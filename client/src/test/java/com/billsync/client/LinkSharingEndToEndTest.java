package com.billsync.client;

import com.billsync.BillSyncBackendApplication;
import com.billsync.client.api.ShareApiClient;
import com.billsync.client.crypto.CryptoEngine;
import com.billsync.client.link.BillShareState;
import com.billsync.client.link.ImportedBill;
import com.billsync.client.link.LinkSharingService;
import com.billsync.client.link.OwnerProfile;
import com.billsync.client.link.SharedLink;
import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.FailureKind;
import com.billsync.protocol.share.ShareStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Owner and recipient sharing a bill through the real HTTP endpoints and in-memory backends.
 */
@SpringBootTest(classes = BillSyncBackendApplication.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LinkSharingEndToEndTest {

    @LocalServerPort
    private int port;

    private final ObjectMapper mapper = ClientJson.newObjectMapper();
    private LinkSharingService owner;
    private LinkSharingService recipient;

    @BeforeEach
    void setup() {
        ClientSettings settings = ClientSettings.forServer("http://localhost:" + port);
        owner = new LinkSharingService(new ShareApiClient(settings), new CryptoEngine(), mapper, settings, Clock.systemUTC());
        recipient = new LinkSharingService(new ShareApiClient(settings), new CryptoEngine(), mapper, settings, Clock.systemUTC());
    }

    private ObjectNode dinner(String total) throws Exception {
        return (ObjectNode) mapper.readTree("""
                {"id":"bill-1","title":"Dinner","total":%s,
                 "participants":[{"id":"p1","name":"Alice","phone":"+1 555 0100"},
                                 {"id":"p2","name":"Bob"}]}
                """.formatted(total));
    }

    @Test
    void linkShouldOpenOnceAndFollowUpdates() throws Exception {
        OwnerProfile alice = new OwnerProfile("Alice", null);
        SharedLink shared = owner.shareBill(dinner("42.00"), "p2", alice, null).block();
        assertNotNull(shared);

        ImportedBill imported = recipient.openLink(shared.url()).block();
        assertNotNull(imported);
        assertEquals("Dinner", imported.payload().bill().get("title").asText());
        assertEquals("42.00", imported.payload().bill().get("total").toString());
        assertEquals("Alice", imported.payload().creatorName());
        assertEquals("p2", imported.participantId());
        assertFalse(imported.payload().bill().at("/participants/0").has("phone"));

        StepVerifier.create(recipient.openLink(shared.url()))
                .expectErrorMatches(ex -> ex instanceof BillSyncException e && e.kind() == FailureKind.NOT_FOUND)
                .verify();

        StepVerifier.create(recipient.pollForUpdate(imported)).verifyComplete();

        BillShareState updated = owner.publishUpdate(shared.state(), dinner("48.00"), alice).block();
        assertEquals(shared.state().shareId(), updated.shareId());

        StepVerifier.create(recipient.pollImportedBills(List.of(imported)))
                .assertNext(bill -> {
                    assertEquals("48.00", bill.payload().bill().get("total").toString());
                    assertTrue(bill.version() > imported.version());
                })
                .verifyComplete();

        StepVerifier.create(owner.checkOwnedShares(List.of(updated)))
                .expectNext(Map.of(updated.shareId(), ShareStatus.State.LIVE))
                .verifyComplete();
    }
}
