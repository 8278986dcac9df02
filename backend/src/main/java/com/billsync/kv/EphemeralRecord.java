package com.billsync.kv;

import java.time.Instant;

/**
 * One entry of an in-memory backend. Reads at or after expiresAt treat the record as absent.
 */
record EphemeralRecord(String key, byte[] value, Instant expiresAt) {

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
