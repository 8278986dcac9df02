package com.billsync.client.crypto;

import com.billsync.protocol.BillSyncException;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * zlib-wrapped deflate, byte-compatible with what browser clients produce with pako.
 * Payloads are compressed before encryption, never after.
 */
public final class Compression {

    /** Refuse to inflate beyond this; a real dataset is far smaller. */
    static final int MAX_INFLATED_BYTES = 64 * 1024 * 1024;

    private Compression() {
    }

    public static byte[] deflate(byte[] input) {
        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
            byte[] buffer = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    /**
     * @throws BillSyncException VALIDATION_FAILURE if the input is not a complete zlib stream
     */
    public static byte[] inflate(byte[] input) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(input);
            ByteArrayOutputStream out = new ByteArrayOutputStream(input.length * 4);
            byte[] buffer = new byte[8192];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && !inflater.finished() && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw BillSyncException.invalid("Compressed payload is truncated.");
                }
                out.write(buffer, 0, n);
                if (out.size() > MAX_INFLATED_BYTES) {
                    throw BillSyncException.invalid("Compressed payload is too large.");
                }
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw BillSyncException.invalid("Payload is not valid compressed data.", e);
        } finally {
            inflater.end();
        }
    }
}
