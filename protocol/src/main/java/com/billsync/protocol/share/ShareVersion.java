package com.billsync.protocol.share;

/**
 * One entry of a POST /share/batch-check body: the version the caller already holds.
 */
public record ShareVersion(String shareId, long version) {}
