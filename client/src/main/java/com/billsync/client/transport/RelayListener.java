package com.billsync.client.transport;

import com.billsync.protocol.relay.RelayMessage;

/**
 * Callbacks from a {@link RelayChannel}. Invoked on the transport's threads; at most one of
 * {@link #onClosed()} and {@link #onFailure(Throwable)} is delivered, and nothing after it.
 */
public interface RelayListener {

    void onMessage(RelayMessage message);

    /** The relay or the local side closed the channel normally. */
    void onClosed();

    /** The channel could not be opened, or dropped abnormally. */
    void onFailure(Throwable error);
}
