package com.billsync.protocol.onetime;

/**
 * GET /onetime-key/{id}/status. Only ever "available"; an absent secret is a 404.
 */
public record OneTimeKeyStatus(String status) {

    public static final String AVAILABLE = "available";

    public static OneTimeKeyStatus available() {
        return new OneTimeKeyStatus(AVAILABLE);
    }

    public boolean isAvailable() {
        return AVAILABLE.equals(status);
    }
}
