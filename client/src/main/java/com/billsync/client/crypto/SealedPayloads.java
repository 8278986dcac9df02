package com.billsync.client.crypto;

import com.billsync.protocol.BillSyncException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * encrypt(deflate(utf8(json))) and back. This is the envelope of every link-sharing blob:
 * the shared bill payload, the wrapped content key and the participant id.
 */
public class SealedPayloads {

    private final CryptoEngine crypto;
    private final ObjectMapper objectMapper;

    public SealedPayloads(CryptoEngine crypto, ObjectMapper objectMapper) {
        this.crypto = crypto;
        this.objectMapper = objectMapper;
    }

    public String sealText(String text, SecretKey key) {
        return crypto.encrypt(Compression.deflate(text.getBytes(StandardCharsets.UTF_8)), key);
    }

    public String openText(String ciphertext, SecretKey key) {
        return new String(Compression.inflate(crypto.decrypt(ciphertext, key)), StandardCharsets.UTF_8);
    }

    public String seal(Object value, SecretKey key) {
        return sealText(toJson(value), key);
    }

    /**
     * @throws BillSyncException VALIDATION_FAILURE on a wrong key, tampering or unexpected JSON
     */
    public <T> T open(String ciphertext, SecretKey key, Class<T> type) {
        String json = openText(ciphertext, key);
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw BillSyncException.invalid("Decrypted payload is not in the expected format.", e);
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload is not serializable", e);
        }
    }
}
