package com.billsync.protocol.share;

/**
 * Returned by POST /share. The updateToken is the owner's proof for later updates; keep it local.
 */
public record ShareCreated(String shareId, long version, String updateToken) {}
