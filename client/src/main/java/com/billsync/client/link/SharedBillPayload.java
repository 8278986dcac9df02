package com.billsync.client.link;

import com.billsync.protocol.JsonWebKey;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Plaintext of a share session. {@code signature} covers {@code bill} as serialized by the client
 * ObjectMapper after one read-back, which turns every floating-point amount into an exact decimal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SharedBillPayload(
        JsonNode bill,              // sanitized: no participant phone or email
        String creatorName,
        JsonWebKey publicKey,       // verifies signature
        String signature,           // Base64 raw r||s
        JsonNode paymentDetails     // optional
) {}
