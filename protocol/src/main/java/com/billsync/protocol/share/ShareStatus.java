package com.billsync.protocol.share;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Liveness of one share session, as reported by POST /share/batch-status.
 */
public record ShareStatus(String shareId, State status) {

    public enum State {
        LIVE("live"),
        EXPIRED("expired");

        private final String wireName;

        State(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }
}
