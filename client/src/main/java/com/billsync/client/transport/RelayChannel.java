package com.billsync.client.transport;

import com.billsync.protocol.relay.RelayMessage;

/**
 * One connection to the sync relay. Single use: open once, close once.
 */
public interface RelayChannel {

    /**
     * Connects asynchronously. With a {@code null} code the relay allocates a new pairing and
     * answers {@code session_created}; with a code it tries to join that pairing.
     */
    void open(String code, RelayListener listener);

    /** Queues a message; silently dropped once the channel is closed. */
    void send(RelayMessage message);

    /** Flushes queued messages and closes. Safe to call at any point, repeatedly. */
    void close();
}
