package com.billsync.protocol.share;

/**
 * Body of GET /share/{id} when the caller does not already hold the latest version.
 * version is epoch millis and strictly increases on every update.
 */
public record ShareSnapshot(String ciphertext, long version) {}
