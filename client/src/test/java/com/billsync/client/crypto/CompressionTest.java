package com.billsync.client.crypto;

import com.billsync.protocol.BillSyncException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompressionTest {

    @Test
    void deflateShouldProduceZlibHeaderAndShrinkRepetitiveInput() {
        byte[] json = "{\"items\":[{\"name\":\"Pizza\"},{\"name\":\"Pizza\"},{\"name\":\"Pizza\"}]}"
                .repeat(20).getBytes(StandardCharsets.UTF_8);

        byte[] deflated = Compression.deflate(json);

        assertEquals(0x78, deflated[0] & 0xff);
        assertTrue(deflated.length < json.length / 4);
        assertArrayEquals(json, Compression.inflate(deflated));
    }

    @Test
    void emptyInputShouldInflateToEmpty() {
        assertEquals(0, Compression.inflate(Compression.deflate(new byte[0])).length);
    }

    @Test
    void truncatedStreamShouldFailValidation() {
        byte[] deflated = Compression.deflate("participant-1234567890".getBytes(StandardCharsets.UTF_8));

        assertThrows(BillSyncException.class,
                () -> Compression.inflate(Arrays.copyOf(deflated, deflated.length / 2)));
    }

    @Test
    void garbageShouldFailValidation() {
        assertThrows(BillSyncException.class,
                () -> Compression.inflate("plainly not zlib".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void bombShouldBeRefused() {
        byte[] bomb = Compression.deflate(new byte[Compression.MAX_INFLATED_BYTES + 1]);

        BillSyncException ex = assertThrows(BillSyncException.class, () -> Compression.inflate(bomb));
        assertEquals("Compressed payload is too large.", ex.getMessage());
    }
}
