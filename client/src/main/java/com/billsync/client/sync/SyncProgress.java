package com.billsync.client.sync;

/**
 * What a UI renders: the state plus the details that go with it.
 */
public record SyncProgress(
        SyncState state,
        SyncRole role,      // null while IDLE
        String code,        // sender's pairing code once assigned
        String message      // user-facing error or notice
) {

    public static SyncProgress idle() {
        return new SyncProgress(SyncState.IDLE, null, null, null);
    }
}
