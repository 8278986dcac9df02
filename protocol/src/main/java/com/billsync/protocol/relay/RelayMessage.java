package com.billsync.protocol.relay;

import com.billsync.protocol.JsonWebKey;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The single JSON envelope carried over the relay's bidirectional stream.
 * Only the fields relevant to {@link #type()} are set; the relay never inspects key or payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelayMessage(
        RelayMessageType type,
        String code,        // session_created only
        JsonWebKey key,     // key only: the transfer key in portable form
        String payload,     // data only: AES-GCM(snapshot), IV prepended, Base64
        String message      // error only: human readable
) {

    public static RelayMessage sessionCreated(String code) {
        return new RelayMessage(RelayMessageType.SESSION_CREATED, code, null, null, null);
    }

    public static RelayMessage peerJoined() {
        return of(RelayMessageType.PEER_JOINED);
    }

    public static RelayMessage key(JsonWebKey key) {
        return new RelayMessage(RelayMessageType.KEY, null, key, null, null);
    }

    public static RelayMessage data(String payload) {
        return new RelayMessage(RelayMessageType.DATA, null, null, payload, null);
    }

    public static RelayMessage syncComplete() {
        return of(RelayMessageType.SYNC_COMPLETE);
    }

    public static RelayMessage syncCancelled() {
        return of(RelayMessageType.SYNC_CANCELLED);
    }

    public static RelayMessage error(String message) {
        return new RelayMessage(RelayMessageType.ERROR, null, null, null, message);
    }

    public static RelayMessage peerDisconnected() {
        return of(RelayMessageType.PEER_DISCONNECTED);
    }

    private static RelayMessage of(RelayMessageType type) {
        return new RelayMessage(type, null, null, null, null);
    }
}
