package com.billsync.relay;

import java.time.Instant;
import java.util.Optional;

/**
 * A code bound to at most two connections. Binding the receiver is the single check-and-set
 * that decides which of two racing receivers wins.
 */
public final class SyncPairing {

    private final String code;
    private final RelayPeer sender;
    private final Instant createdAt;

    private RelayPeer receiver;
    private boolean released;

    SyncPairing(String code, RelayPeer sender, Instant createdAt) {
        this.code = code;
        this.sender = sender;
        this.createdAt = createdAt;
    }

    public String code() {
        return code;
    }

    public RelayPeer sender() {
        return sender;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized Optional<RelayPeer> receiver() {
        return Optional.ofNullable(receiver);
    }

    public synchronized boolean isPaired() {
        return receiver != null;
    }

    /** False if a receiver is already bound or the pairing has been torn down. */
    synchronized boolean bindReceiver(RelayPeer candidate) {
        if (released || receiver != null) {
            return false;
        }
        receiver = candidate;
        return true;
    }

    synchronized boolean isReleased() {
        return released;
    }

    synchronized void markReleased() {
        released = true;
    }

    /** The other side of {@code peer}, if one is bound. */
    synchronized Optional<RelayPeer> counterpart(RelayPeer peer) {
        if (peer == sender) {
            return Optional.ofNullable(receiver);
        }
        if (peer == receiver) {
            return Optional.of(sender);
        }
        return Optional.empty();
    }
}
