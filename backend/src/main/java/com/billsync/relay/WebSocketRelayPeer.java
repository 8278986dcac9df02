package com.billsync.relay;

import com.billsync.protocol.relay.RelayMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Queues outbound frames for one WebSocket session. Sends may come from the counterpart's
 * inbound thread, so emission is serialized here.
 */
final class WebSocketRelayPeer implements RelayPeer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketRelayPeer.class);

    private final String id;
    private final Sinks.Many<RelayMessage> outbound = Sinks.many().unicast().onBackpressureBuffer();

    WebSocketRelayPeer(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized void send(RelayMessage message) {
        Sinks.EmitResult result = outbound.tryEmitNext(message);
        if (result.isFailure()) {
            log.debug("Dropped {} for closed connection {}: {}", message.type(), id, result);
        }
    }

    @Override
    public synchronized void close() {
        outbound.tryEmitComplete();
    }

    Flux<RelayMessage> outbound() {
        return outbound.asFlux();
    }
}
