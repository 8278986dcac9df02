package com.billsync.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Portable key form (RFC 7517 subset). This is the only shape in which keys leave a device:
 * inside an encrypted payload, inside a relay "key" message, or base64url-encoded in a URL fragment.
 *
 * Symmetric keys use kty=oct + k. EC keys use kty=EC + crv/x/y, and d for the private half.
 * All byte fields are base64url without padding.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonWebKey(
        String kty,     // "oct" or "EC"
        String alg,     // "A256GCM" for content keys; null for EC
        String crv,     // "P-384" for signing keys
        String k,       // raw AES key bytes
        String x,
        String y,
        String d,       // private scalar: present only in the owner's local copy
        Boolean ext
) {

    public static JsonWebKey symmetric(String k) {
        return new JsonWebKey("oct", "A256GCM", null, k, null, null, null, Boolean.TRUE);
    }

    public static JsonWebKey ecPublic(String crv, String x, String y) {
        return new JsonWebKey("EC", null, crv, null, x, y, null, Boolean.TRUE);
    }

    public static JsonWebKey ecPrivate(String crv, String x, String y, String d) {
        return new JsonWebKey("EC", null, crv, null, x, y, d, Boolean.TRUE);
    }

    /** Drops the private scalar so the key can travel with a payload. */
    public JsonWebKey publicOnly() {
        return new JsonWebKey(kty, alg, crv, k, x, y, null, ext);
    }
}
