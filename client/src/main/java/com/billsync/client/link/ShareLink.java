package com.billsync.client.link;

import com.billsync.client.crypto.Base64Url;
import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.JsonWebKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * The distributable link. Everything after {@code #} stays in the browser, so the fragment key
 * never reaches a server:
 * <pre>{base}#/view-bill?shareId=..&amp;keyId=..&amp;fragmentKey=base64url(JWK JSON)&amp;p=base64url(ciphertext)</pre>
 */
public record ShareLink(
        String shareId,
        String keyId,
        JsonWebKey fragmentKey,
        String encryptedParticipantId
) {

    static final String ROUTE = "#/view-bill?";

    public String toUrl(String base, ObjectMapper objectMapper) {
        String fragmentJson;
        try {
            fragmentJson = objectMapper.writeValueAsString(fragmentKey);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Fragment key is not serializable", e);
        }
        return base + ROUTE
                + "shareId=" + encode(shareId)
                + "&keyId=" + encode(keyId)
                + "&fragmentKey=" + Base64Url.encode(fragmentJson.getBytes(StandardCharsets.UTF_8))
                + "&p=" + encryptedParticipantId;
    }

    /**
     * @throws BillSyncException VALIDATION_FAILURE if any component is missing or unreadable
     */
    public static ShareLink parse(String url, ObjectMapper objectMapper) {
        int query = url == null ? -1 : url.indexOf('?', Math.max(0, url.indexOf('#')));
        if (url == null || url.indexOf('#') < 0 || query < 0) {
            throw BillSyncException.invalid("Share link is missing parameters.");
        }
        Map<String, String> params = new HashMap<>();
        for (String pair : url.substring(query + 1).split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(pair.substring(0, eq), URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        String shareId = params.get("shareId");
        String keyId = params.get("keyId");
        String fragment = params.get("fragmentKey");
        String participant = params.get("p");
        if (isBlank(shareId) || isBlank(keyId) || isBlank(fragment) || isBlank(participant)) {
            throw BillSyncException.invalid("Invalid or incomplete share link. All components are required.");
        }
        try {
            JsonWebKey fragmentKey = objectMapper.readValue(Base64Url.decode(fragment), JsonWebKey.class);
            return new ShareLink(shareId, keyId, fragmentKey, participant);
        } catch (IOException e) {
            throw BillSyncException.invalid("Share link key is unreadable.", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
