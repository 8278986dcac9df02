package com.billsync.client.sync;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * The device's durable storage, seen as one snapshot.
 */
public interface LocalDataStore {

    Mono<JsonNode> exportAllData();

    /** Replaces all local data with {@code snapshot}; must commit atomically or not at all. */
    Mono<Void> importAllData(JsonNode snapshot);
}
