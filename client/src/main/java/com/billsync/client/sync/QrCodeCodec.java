package com.billsync.client.sync;

import java.util.Optional;

/**
 * Renders a pairing code for scanning and reads one back from scanner output.
 */
public interface QrCodeCodec {

    /** Displayable form of {@code code}, e.g. an SVG document or an image data URL. */
    String encode(String code);

    /** The pairing code carried by {@code scanned}, or empty if it holds none. */
    Optional<String> decode(String scanned);
}
