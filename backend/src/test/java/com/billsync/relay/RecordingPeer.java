package com.billsync.relay;

import com.billsync.protocol.relay.RelayMessage;
import com.billsync.protocol.relay.RelayMessageType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** In-memory peer that records what the relay sends it. */
class RecordingPeer implements RelayPeer {

    private final String id;
    final List<RelayMessage> received = new CopyOnWriteArrayList<>();
    volatile boolean closed;

    RecordingPeer(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(RelayMessage message) {
        received.add(message);
    }

    @Override
    public void close() {
        closed = true;
    }

    RelayMessage last() {
        return received.get(received.size() - 1);
    }

    List<RelayMessageType> types() {
        return received.stream().map(RelayMessage::type).toList();
    }
}
