package com.billsync.client.transport;

import com.billsync.client.ClientJson;
import com.billsync.client.ClientSettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;

class WebSocketRelayChannelTest {

    private final ClientSettings settings = ClientSettings.forServer("https://bills.example");

    @Test
    void clientShouldAcceptFramesUpToConfiguredLimit() {
        assertEquals(settings.maxFrameBytes(),
                WebSocketRelayChannel.webSocketClient(settings).getWebsocketClientSpec().maxFramePayloadLength());
    }

    @Test
    void factoryShouldHandOutFreshChannels() {
        RelayChannelFactory factory = WebSocketRelayChannel.factory(settings, ClientJson.newObjectMapper());

        RelayChannel first = factory.create();
        RelayChannel second = factory.create();

        assertInstanceOf(WebSocketRelayChannel.class, first);
        assertNotSame(first, second);
    }
}
