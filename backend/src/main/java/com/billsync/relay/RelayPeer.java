package com.billsync.relay;

import com.billsync.protocol.relay.RelayMessage;

/**
 * One end of a relay connection as the pairing logic sees it. Implementations must make
 * {@link #send} safe to call from any thread.
 */
public interface RelayPeer {

    /** Unique per connection. */
    String id();

    void send(RelayMessage message);

    /** Closes the connection after already-queued messages have been flushed. */
    void close();
}
