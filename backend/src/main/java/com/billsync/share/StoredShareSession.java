package com.billsync.share;

/**
 * What the store holds under {@code share:{id}}, serialized as JSON.
 */
public record StoredShareSession(
        String ciphertext,      // opaque to the server
        long version,           // epoch millis, strictly increasing per session
        String updateToken      // owner's proof for updates, never returned by fetch
) {}
