package com.billsync.relay;

import com.billsync.protocol.relay.RelayMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * Adapts a WebSocket session to {@link SyncRelay}: one JSON {@link RelayMessage} per text frame,
 * optional {@code ?code=} on the handshake URI.
 */
@Component
public class RelayWebSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    private final SyncRelay relay;
    private final ObjectMapper objectMapper;

    public RelayWebSocketHandler(SyncRelay relay, ObjectMapper objectMapper) {
        this.relay = relay;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        WebSocketRelayPeer peer = new WebSocketRelayPeer(session.getId());
        String code = UriComponentsBuilder.fromUri(session.getHandshakeInfo().getUri())
                .build()
                .getQueryParams()
                .getFirst("code");

        Mono<Void> outbound = session.send(peer.outbound().map(message -> session.textMessage(encode(message))))
                .then(Mono.defer(session::close))
                .onErrorResume(e -> {
                    log.debug("Outbound stream of {} ended with {}", session.getId(), e.toString());
                    return Mono.empty();
                });

        Mono<Void> inbound = Mono.fromRunnable(() -> relay.onOpen(peer, code))
                .thenMany(session.receive().map(WebSocketMessage::getPayloadAsText))
                .doOnNext(text -> dispatch(peer, text))
                .doFinally(signal -> {
                    relay.onClose(peer);
                    peer.close();
                })
                .then();

        return Mono.when(outbound, inbound);
    }

    private void dispatch(WebSocketRelayPeer peer, String text) {
        RelayMessage message;
        try {
            message = objectMapper.readValue(text, RelayMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("Malformed frame from {}: {}", peer.id(), e.getOriginalMessage());
            relay.onMalformed(peer);
            return;
        }
        relay.onMessage(peer, message);
    }

    private String encode(RelayMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Relay message is not serializable", e);
        }
    }
}
