package com.billsync.protocol.share;

/**
 * One entry of a POST /share/batch-check response: only sessions newer than the caller's copy.
 */
public record ShareChange(String shareId, String ciphertext, long version) {}
