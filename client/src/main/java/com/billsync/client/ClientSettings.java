package com.billsync.client;

import java.net.URI;
import java.time.Duration;

/**
 * Immutable client configuration.
 */
public record ClientSettings(
        URI apiBaseUrl,                     // share and one-time key endpoints
        URI relayUrl,                       // device-sync relay WebSocket
        String shareLinkBase,               // prefix of distributable links, before the '#'
        Duration requestTimeout,            // per HTTP call
        Duration connectTimeout,            // connecting -> waiting/connected
        Duration participantLinkLifetime,   // how long an issued link is trusted without re-minting
        int maxFrameBytes                   // largest relay frame accepted
) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_PARTICIPANT_LINK_LIFETIME = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    /**
     * Defaults for a server at {@code baseUrl}: the relay lives at {@code /sync} on the same host
     * and links point at the server root.
     */
    public static ClientSettings forServer(String baseUrl) {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String relay = trimmed.replaceFirst("^http", "ws") + "/sync";
        return new ClientSettings(
                URI.create(trimmed),
                URI.create(relay),
                trimmed + "/",
                DEFAULT_REQUEST_TIMEOUT,
                DEFAULT_CONNECT_TIMEOUT,
                DEFAULT_PARTICIPANT_LINK_LIFETIME,
                DEFAULT_MAX_FRAME_BYTES);
    }

    public ClientSettings withConnectTimeout(Duration timeout) {
        return new ClientSettings(apiBaseUrl, relayUrl, shareLinkBase, requestTimeout, timeout,
                participantLinkLifetime, maxFrameBytes);
    }
}
