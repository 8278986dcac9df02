package com.billsync.protocol.onetime;

/**
 * Body of POST /onetime-key. The payload is a content key wrapped under a fragment key
 * the server never sees.
 */
public record OneTimeKeyRequest(String encryptedPayload) {}
