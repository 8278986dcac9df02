package com.billsync.client.crypto;

import com.billsync.protocol.BillSyncException;

import java.util.Base64;

/**
 * URL-safe Base64 without padding, the encoding of every value that ends up in a link.
 * Decoding also accepts the standard alphabet and padding, since browsers produce both.
 */
public final class Base64Url {

    private Base64Url() {
    }

    public static String encode(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * @throws BillSyncException VALIDATION_FAILURE if the input is not Base64 in either alphabet
     */
    public static byte[] decode(String value) {
        if (value == null) {
            throw BillSyncException.invalid("Missing Base64 value.");
        }
        // the JDK decoder treats padding as optional
        String standard = value.strip().replace('-', '+').replace('_', '/');
        try {
            return Base64.getDecoder().decode(standard);
        } catch (IllegalArgumentException e) {
            throw BillSyncException.invalid("Value is not valid Base64.", e);
        }
    }
}
