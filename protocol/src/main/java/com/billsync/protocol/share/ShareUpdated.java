package com.billsync.protocol.share;

public record ShareUpdated(String shareId, long version) {}
