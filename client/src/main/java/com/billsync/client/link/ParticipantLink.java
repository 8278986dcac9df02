package com.billsync.client.link;

import com.billsync.protocol.JsonWebKey;

import java.time.Instant;

/**
 * The last link minted for one participant. The owner keeps it locally and re-issues the same
 * URL while it is fresh and its one-time key is still unconsumed.
 */
public record ParticipantLink(
        String keyId,           // one-time secret holding the wrapped content key
        JsonWebKey fragmentKey, // unwraps it; lives only in the URL fragment and here
        Instant expiresAt       // local trust horizon, not the server TTL
) {

    public boolean isFresh(Instant now) {
        return now.isBefore(expiresAt);
    }
}
