package com.billsync.relay;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.Map;

@Configuration
public class RelayWebSocketConfig implements WebFluxConfigurer {

    private final RelayProperties properties;

    public RelayWebSocketConfig(RelayProperties properties) {
        this.properties = properties;
    }

    @Bean
    public HandlerMapping relayHandlerMapping(RelayWebSocketHandler handler) {
        // ahead of the annotated controllers
        return new SimpleUrlHandlerMapping(Map.of(properties.path(), handler), -1);
    }

    @Override
    public WebSocketService getWebSocketService() {
        return new HandshakeWebSocketService(new ReactorNettyRequestUpgradeStrategy(
                () -> WebsocketServerSpec.builder().maxFramePayloadLength(properties.maxFrameBytes())));
    }
}
