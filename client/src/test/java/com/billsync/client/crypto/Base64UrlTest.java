package com.billsync.client.crypto;

import com.billsync.protocol.BillSyncException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class Base64UrlTest {

    private static final byte[] BYTES = {(byte) 0xfb, (byte) 0xff, (byte) 0xbf, 0x01};

    @Test
    void encodeShouldUseUrlAlphabetWithoutPadding() {
        assertEquals("-_-_AQ", Base64Url.encode(BYTES));
    }

    @Test
    void decodeShouldAcceptEitherAlphabetWithOrWithoutPadding() {
        assertArrayEquals(BYTES, Base64Url.decode("-_-_AQ"));
        assertArrayEquals(BYTES, Base64Url.decode("+/+/AQ=="));
        assertArrayEquals(BYTES, Base64Url.decode("+/+/AQ"));
        assertArrayEquals(BYTES, Base64Url.decode("-_-_AQ=="));
    }

    @Test
    void decodeShouldRejectNonBase64() {
        assertThrows(BillSyncException.class, () -> Base64Url.decode("not*base64"));
        assertThrows(BillSyncException.class, () -> Base64Url.decode(null));
    }
}
