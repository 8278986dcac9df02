package com.billsync.client.transport;

import com.billsync.client.ClientSettings;
import com.billsync.protocol.relay.RelayMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;

import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link RelayChannel} over a WebSocket: one JSON {@link RelayMessage} per text frame.
 */
public class WebSocketRelayChannel implements RelayChannel {

    private static final Logger log = LoggerFactory.getLogger(WebSocketRelayChannel.class);

    private final WebSocketClient client;
    private final URI relayUrl;
    private final ObjectMapper objectMapper;

    private final Sinks.Many<RelayMessage> outbound = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean opened = new AtomicBoolean();
    private final AtomicBoolean established = new AtomicBoolean();
    private volatile Disposable connection;

    public WebSocketRelayChannel(WebSocketClient client, URI relayUrl, ObjectMapper objectMapper) {
        this.client = client;
        this.relayUrl = relayUrl;
        this.objectMapper = objectMapper;
    }

    /** A factory whose channels share one client configured from {@code settings}. */
    public static RelayChannelFactory factory(ClientSettings settings, ObjectMapper objectMapper) {
        WebSocketClient client = webSocketClient(settings);
        return () -> new WebSocketRelayChannel(client, settings.relayUrl(), objectMapper);
    }

    static ReactorNettyWebSocketClient webSocketClient(ClientSettings settings) {
        return new ReactorNettyWebSocketClient(HttpClient.create(),
                () -> WebsocketClientSpec.builder().maxFramePayloadLength(settings.maxFrameBytes()));
    }

    @Override
    public void open(String code, RelayListener listener) {
        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("Relay channel already opened");
        }
        URI target = code == null
                ? relayUrl
                : UriComponentsBuilder.fromUri(relayUrl).queryParam("code", code).build().toUri();
        log.debug("Connecting to relay at {}", relayUrl);

        connection = client.execute(target, session -> exchange(session, listener))
                .subscribe(
                        ignored -> { },
                        error -> {
                            log.debug("Relay channel failed: {}", error.toString());
                            listener.onFailure(error);
                        },
                        listener::onClosed);
    }

    private Mono<Void> exchange(WebSocketSession session, RelayListener listener) {
        established.set(true);
        Mono<Void> send = session.send(outbound.asFlux().map(message -> session.textMessage(encode(message))))
                .then(Mono.defer(session::close))
                .onErrorResume(e -> {
                    log.debug("Outbound stream ended with {}", e.toString());
                    return Mono.empty();
                });
        Mono<Void> receive = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(text -> dispatch(text, listener))
                .doFinally(signal -> outbound.tryEmitComplete())
                .then();
        return Mono.when(send, receive);
    }

    @Override
    public synchronized void send(RelayMessage message) {
        Sinks.EmitResult result = outbound.tryEmitNext(message);
        if (result.isFailure()) {
            log.debug("Dropped outgoing {}: {}", message.type(), result);
        }
    }

    @Override
    public synchronized void close() {
        outbound.tryEmitComplete();
        Disposable current = connection;
        // Still in the handshake: nothing to flush, abort the attempt.
        if (current != null && !established.get()) {
            current.dispose();
        }
    }

    private void dispatch(String text, RelayListener listener) {
        RelayMessage message;
        try {
            message = objectMapper.readValue(text, RelayMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed relay frame: {}", e.getOriginalMessage());
            return;
        }
        listener.onMessage(message);
    }

    private String encode(RelayMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Relay message is not serializable", e);
        }
    }
}
