package com.billsync.protocol.share;

/**
 * Body of POST /share (create) and POST /share/{id} (update).
 * The backend is a blind carrier: ciphertext is opaque to it.
 */
public record ShareRequest(
        String ciphertext,      // AES-GCM(deflate(payload)), IV prepended, Base64
        String updateToken      // null on create; required on update
) {

    public static ShareRequest create(String ciphertext) {
        return new ShareRequest(ciphertext, null);
    }
}
