package com.billsync.client;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * The client's single ObjectMapper configuration.
 *
 * <p>Signatures cover serialized JSON, so a parsed bill must serialize back to the same text:
 * decimals are kept as exact BigDecimals ({@code 42.00} stays {@code 42.00}) and written without
 * an exponent, and object field order is preserved.
 */
public final class ClientJson {

    private ClientJson() {
    }

    public static ObjectMapper newObjectMapper() {
        return JsonMapper.builder()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
                .build();
    }
}
