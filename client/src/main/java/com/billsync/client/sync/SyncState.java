package com.billsync.client.sync;

/**
 * Lifecycle of one device-sync transfer, shared by both roles.
 * WAITING is sender-only; RECEIVING and CONFIRMING are receiver-only.
 */
public enum SyncState {
    IDLE,
    CONNECTING,
    WAITING,
    CONNECTED,
    SENDING,
    RECEIVING,
    CONFIRMING,
    COMPLETE,
    ERROR;

    /** COMPLETE and ERROR; only RESET leaves them. */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    /** A transfer is underway: a channel is, or is about to be, open. */
    public boolean isActive() {
        return this != IDLE && !isTerminal();
    }
}
