package com.billsync.relay;

import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.PairingCodes;
import com.billsync.protocol.relay.RelayMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rendezvous and forwarding logic of the device-sync relay, independent of the transport.
 *
 * <p><strong>Blind forwarder contract:</strong> key and data frames are passed to the counterpart
 * as-is and never stored or logged. The relay answers with its own {@code error} frames only for
 * protocol violations, and models every disconnect as {@code peer_disconnected}.
 */
@Component
public class SyncRelay {

    private static final Logger log = LoggerFactory.getLogger(SyncRelay.class);

    private final PairingRegistry registry;

    public SyncRelay(PairingRegistry registry) {
        this.registry = registry;
    }

    /**
     * A connection without a code is a sender asking for one; with a code it is a receiver
     * asking to join. Rejected receivers get an explicit error and are closed.
     */
    public void onOpen(RelayPeer peer, String code) {
        if (code == null || code.isBlank()) {
            openAsSender(peer);
        } else {
            openAsReceiver(peer, code.strip());
        }
    }

    public void onMessage(RelayPeer peer, RelayMessage message) {
        if (message.type() == null || !message.type().isForwardable()) {
            peer.send(RelayMessage.error("Unsupported message type."));
            return;
        }
        SyncPairing pairing = registry.pairingOf(peer).orElse(null);
        if (pairing == null) {
            peer.send(RelayMessage.error("Not connected to a sync session."));
            return;
        }
        RelayPeer counterpart = pairing.counterpart(peer).orElse(null);
        if (counterpart == null) {
            peer.send(RelayMessage.error("No device has joined this session yet."));
            return;
        }
        // Released before forwarding so the code is dead by the time either side sees the end.
        if (message.type().endsPairing()) {
            log.info("Pairing {} finished with {}", pairing.code(), message.type());
            registry.release(pairing.code());
        }
        counterpart.send(message);
    }

    public void onMalformed(RelayPeer peer) {
        peer.send(RelayMessage.error("Malformed message."));
    }

    /** Drops the pairing and tells the remaining side, if any. */
    public void onClose(RelayPeer peer) {
        registry.pairingOf(peer)
                .flatMap(pairing -> registry.release(pairing.code()))
                .ifPresent(pairing -> pairing.counterpart(peer).ifPresent(other -> {
                    log.info("Pairing {} lost a connection before completion", pairing.code());
                    other.send(RelayMessage.peerDisconnected());
                }));
    }

    private void openAsSender(RelayPeer peer) {
        try {
            SyncPairing pairing = registry.create(peer);
            peer.send(RelayMessage.sessionCreated(pairing.code()));
        } catch (BillSyncException e) {
            log.warn("Could not create a pairing: {}", e.getMessage());
            peer.send(RelayMessage.error(e.getMessage()));
            peer.close();
        }
    }

    private void openAsReceiver(RelayPeer peer, String code) {
        if (!PairingCodes.isWellFormed(code)) {
            reject(peer, "Invalid pairing code.");
            return;
        }
        switch (registry.bind(code, peer)) {
            case BOUND -> registry.pairingOf(peer).ifPresent(pairing -> {
                pairing.sender().send(RelayMessage.peerJoined());
                peer.send(RelayMessage.peerJoined());
            });
            case UNKNOWN_CODE -> reject(peer, "Invalid or expired code.");
            case ALREADY_PAIRED -> reject(peer, "This code is already in use by another device.");
        }
    }

    private static void reject(RelayPeer peer, String reason) {
        peer.send(RelayMessage.error(reason));
        peer.close();
    }
}
