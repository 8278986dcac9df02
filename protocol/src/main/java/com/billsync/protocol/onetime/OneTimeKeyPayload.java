package com.billsync.protocol.onetime;

/**
 * Returned exactly once by GET /onetime-key/{id}; the secret is gone from the server afterwards.
 */
public record OneTimeKeyPayload(String encryptedPayload) {}
