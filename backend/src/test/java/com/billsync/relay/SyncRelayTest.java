package com.billsync.relay;

import com.billsync.protocol.JsonWebKey;
import com.billsync.protocol.relay.RelayMessage;
import com.billsync.protocol.relay.RelayMessageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

/**
 * Relay protocol behavior with in-memory peers; no sockets involved.
 */
@ExtendWith(MockitoExtension.class)
class SyncRelayTest {

    @Mock
    private PairingCodeGenerator codes;

    private PairingRegistry registry;
    private SyncRelay relay;

    private RecordingPeer sender;
    private RecordingPeer receiver;

    @BeforeEach
    void setup() {
        registry = new PairingRegistry(codes, Clock.systemUTC());
        relay = new SyncRelay(registry);
        sender = new RecordingPeer("sender");
        receiver = new RecordingPeer("receiver");
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void pair() {
        when(codes.nextCode()).thenReturn("482913");
        relay.onOpen(sender, null);
        relay.onOpen(receiver, "482913");
    }

    // ── Rendezvous ────────────────────────────────────────────────────────────

    @Test
    void senderWithoutCodeShouldReceiveSessionCreated() {
        when(codes.nextCode()).thenReturn("482913");

        relay.onOpen(sender, null);

        assertEquals(RelayMessage.sessionCreated("482913"), sender.last());
        assertTrue(registry.find("482913").isPresent());
    }

    @Test
    void receiverWithCodeShouldPairAndNotifyBothSides() {
        pair();

        assertEquals(List.of(RelayMessageType.SESSION_CREATED, RelayMessageType.PEER_JOINED), sender.types());
        assertEquals(List.of(RelayMessageType.PEER_JOINED), receiver.types());
        assertFalse(receiver.closed);
    }

    @Test
    void secondReceiverShouldBeRejectedExplicitly() {
        pair();
        RecordingPeer intruder = new RecordingPeer("intruder");

        relay.onOpen(intruder, "482913");

        assertEquals(RelayMessage.error("This code is already in use by another device."), intruder.last());
        assertTrue(intruder.closed);
        assertEquals(List.of(RelayMessageType.PEER_JOINED), receiver.types());
    }

    @Test
    void unknownCodeShouldBeRejected() {
        relay.onOpen(receiver, "123456");

        assertEquals(RelayMessage.error("Invalid or expired code."), receiver.last());
        assertTrue(receiver.closed);
    }

    @Test
    void malformedCodeShouldBeRejected() {
        relay.onOpen(receiver, "12ab");

        assertEquals(RelayMessage.error("Invalid pairing code."), receiver.last());
        assertTrue(receiver.closed);
    }

    // ── Forwarding ────────────────────────────────────────────────────────────

    @Test
    void keyAndDataShouldBeForwardedVerbatim() {
        pair();
        RelayMessage key = RelayMessage.key(JsonWebKey.symmetric("c2VjcmV0"));
        RelayMessage data = RelayMessage.data("aXYtYW5kLWNpcGhlcnRleHQ=");

        relay.onMessage(sender, key);
        relay.onMessage(sender, data);

        assertSame(key, receiver.received.get(1));
        assertSame(data, receiver.received.get(2));
    }

    @Test
    void syncCompleteShouldBeForwardedAndRetireTheCode() {
        pair();

        relay.onMessage(receiver, RelayMessage.syncComplete());

        assertEquals(RelayMessageType.SYNC_COMPLETE, sender.last().type());
        assertTrue(registry.find("482913").isEmpty());

        RecordingPeer late = new RecordingPeer("late");
        relay.onOpen(late, "482913");
        assertEquals(RelayMessage.error("Invalid or expired code."), late.last());
    }

    @Test
    void cancellationShouldBeForwardedAndRetireTheCode() {
        pair();

        relay.onMessage(receiver, RelayMessage.syncCancelled());

        assertEquals(RelayMessageType.SYNC_CANCELLED, sender.last().type());
        assertEquals(0, registry.size());
    }

    @Test
    void messageBeforeReceiverJoinsShouldBeAnsweredWithError() {
        when(codes.nextCode()).thenReturn("482913");
        relay.onOpen(sender, null);

        relay.onMessage(sender, RelayMessage.data("early"));

        assertEquals(RelayMessage.error("No device has joined this session yet."), sender.last());
    }

    @Test
    void messageFromUnpairedPeerShouldBeAnsweredWithError() {
        relay.onMessage(receiver, RelayMessage.data("stray"));

        assertEquals(RelayMessage.error("Not connected to a sync session."), receiver.last());
    }

    @Test
    void relayOnlyMessagesShouldNotBeForwarded() {
        pair();

        relay.onMessage(sender, RelayMessage.peerJoined());

        assertEquals(RelayMessage.error("Unsupported message type."), sender.last());
        assertEquals(1, receiver.received.size());
    }

    @Test
    void malformedFrameShouldBeAnsweredWithError() {
        relay.onMalformed(sender);

        assertEquals(RelayMessage.error("Malformed message."), sender.last());
    }

    // ── Disconnect ────────────────────────────────────────────────────────────

    @Test
    void dropBeforeCompletionShouldNotifyRemainingSideAndDiscardCode() {
        pair();

        relay.onClose(sender);

        assertEquals(RelayMessageType.PEER_DISCONNECTED, receiver.last().type());
        assertTrue(registry.find("482913").isEmpty());
        assertTrue(registry.pairingOf(receiver).isEmpty());
    }

    @Test
    void senderDropWhileWaitingShouldDiscardCode() {
        when(codes.nextCode()).thenReturn("482913");
        relay.onOpen(sender, null);

        relay.onClose(sender);

        assertEquals(0, registry.size());
    }

    @Test
    void closeAfterCompletionShouldNotNotify() {
        pair();
        relay.onMessage(receiver, RelayMessage.syncComplete());
        int before = receiver.received.size();

        relay.onClose(sender);

        assertEquals(before, receiver.received.size());
    }
}
