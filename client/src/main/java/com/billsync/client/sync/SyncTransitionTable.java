package com.billsync.client.sync;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every allowed (state, event) pair and where it leads. Anything not listed is rejected.
 */
public final class SyncTransitionTable {

    private static final Map<SyncState, Map<SyncEvent, SyncState>> TABLE = new EnumMap<>(SyncState.class);

    static {
        allow(SyncState.IDLE, SyncEvent.START_SENDING, SyncState.CONNECTING);
        allow(SyncState.IDLE, SyncEvent.START_RECEIVING, SyncState.CONNECTING);
        allow(SyncState.IDLE, SyncEvent.FAIL, SyncState.ERROR);     // malformed code, rejected locally

        allow(SyncState.CONNECTING, SyncEvent.SESSION_CREATED, SyncState.WAITING);
        allow(SyncState.CONNECTING, SyncEvent.PEER_JOINED, SyncState.CONNECTED);
        allow(SyncState.WAITING, SyncEvent.PEER_JOINED, SyncState.CONNECTED);
        allow(SyncState.CONNECTED, SyncEvent.TRANSFER_STARTED, SyncState.SENDING);
        allow(SyncState.CONNECTED, SyncEvent.DATA_RECEIVED, SyncState.RECEIVING);
        allow(SyncState.SENDING, SyncEvent.PEER_COMPLETED, SyncState.COMPLETE);
        allow(SyncState.RECEIVING, SyncEvent.DECRYPTED, SyncState.CONFIRMING);
        allow(SyncState.CONFIRMING, SyncEvent.IMPORT_APPLIED, SyncState.COMPLETE);

        for (SyncState state : SyncState.values()) {
            if (state.isActive()) {
                allow(state, SyncEvent.FAIL, SyncState.ERROR);
                allow(state, SyncEvent.CANCEL, SyncState.IDLE);
            }
        }
        allow(SyncState.COMPLETE, SyncEvent.RESET, SyncState.IDLE);
        allow(SyncState.ERROR, SyncEvent.RESET, SyncState.IDLE);
    }

    private SyncTransitionTable() {
    }

    private static void allow(SyncState from, SyncEvent event, SyncState to) {
        TABLE.computeIfAbsent(from, s -> new EnumMap<>(SyncEvent.class)).put(event, to);
    }

    public static Optional<SyncState> next(SyncState from, SyncEvent event) {
        return Optional.ofNullable(TABLE.getOrDefault(from, Map.of()).get(event));
    }

    public static Map<SyncEvent, SyncState> allowedFrom(SyncState from) {
        return Collections.unmodifiableMap(TABLE.getOrDefault(from, Map.of()));
    }
}
