package com.billsync.protocol.onetime;

public record OneTimeKeyCreated(String keyId) {}
