package com.billsync.protocol.relay;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Message types exchanged over the sync relay.
 * Relay-originated: SESSION_CREATED, PEER_JOINED, PEER_DISCONNECTED, and ERROR on rejection.
 * Peer-to-peer (forwarded verbatim): KEY, DATA, SYNC_COMPLETE, SYNC_CANCELLED, ERROR.
 */
public enum RelayMessageType {
    SESSION_CREATED("session_created"),
    PEER_JOINED("peer_joined"),
    KEY("key"),
    DATA("data"),
    SYNC_COMPLETE("sync_complete"),
    SYNC_CANCELLED("sync_cancelled"),
    ERROR("error"),
    PEER_DISCONNECTED("peer_disconnected");

    private final String wireName;

    RelayMessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Types a paired peer may send; everything else is relay-only. */
    public boolean isForwardable() {
        return this == KEY || this == DATA || this == SYNC_COMPLETE || this == SYNC_CANCELLED || this == ERROR;
    }

    /** Types after which the relay discards the pairing. */
    public boolean endsPairing() {
        return this == SYNC_COMPLETE || this == SYNC_CANCELLED;
    }
}
