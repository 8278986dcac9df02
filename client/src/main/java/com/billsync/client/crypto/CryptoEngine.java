package com.billsync.client.crypto;

import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.JsonWebKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.BigIntegers;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.Signature;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPrivateKeySpec;
import java.security.spec.ECPublicKeySpec;
import java.util.Base64;

/**
 * Symmetric authenticated encryption, signing and key serialization, all through the
 * BouncyCastle JCA provider.
 *
 * <ul>
 *   <li>Content keys: AES-256-GCM, 96-bit random IV prepended to the ciphertext, Base64.</li>
 *   <li>Signing keys: ECDSA P-384 / SHA-384 with raw r||s signatures, the WebCrypto encoding.</li>
 *   <li>Portable form: {@link JsonWebKey}.</li>
 * </ul>
 *
 * Instances are stateless apart from the random source and safe to share between threads.
 */
public class CryptoEngine {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final String PROVIDER = BouncyCastleProvider.PROVIDER_NAME;
    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final int AES_KEY_BITS = 256;
    private static final int IV_SIZE = 12;      // 96-bit IV
    private static final int TAG_BITS = 128;
    private static final String CURVE = "secp384r1";
    private static final String JWK_CURVE = "P-384";
    private static final int COORDINATE_BYTES = 48;
    private static final String SIGNATURE_ALGO = "SHA384withPLAIN-ECDSA";

    private final SecureRandom random = new SecureRandom();

    // ── Key generation ───────────────────────────────────────────────────────

    public SecretKey generateContentKey() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES", PROVIDER);
            generator.init(AES_KEY_BITS, random);
            return generator.generateKey();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-256 is unavailable", e);
        }
    }

    public KeyPair generateSigningKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC", PROVIDER);
            generator.initialize(new ECGenParameterSpec(CURVE), random);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("ECDSA P-384 is unavailable", e);
        }
    }

    // ── AES-GCM ──────────────────────────────────────────────────────────────

    /** @return Base64(iv || ciphertext || tag) */
    public String encrypt(byte[] plaintext, SecretKey key) {
        byte[] iv = new byte[IV_SIZE];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, PROVIDER);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);

            byte[] result = new byte[IV_SIZE + ciphertext.length];
            System.arraycopy(iv, 0, result, 0, IV_SIZE);
            System.arraycopy(ciphertext, 0, result, IV_SIZE, ciphertext.length);
            return Base64.getEncoder().encodeToString(result);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    public String encrypt(String plaintext, SecretKey key) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
    }

    /**
     * Accepts standard or URL-safe Base64, padded or not.
     *
     * @throws BillSyncException VALIDATION_FAILURE on a wrong key, tampering or malformed input
     */
    public byte[] decrypt(String ciphertext, SecretKey key) {
        byte[] decoded = Base64Url.decode(ciphertext);
        if (decoded.length < IV_SIZE + TAG_BITS / 8) {
            throw BillSyncException.invalid("Ciphertext is too short.");
        }
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, PROVIDER);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, decoded, 0, IV_SIZE));
            return cipher.doFinal(decoded, IV_SIZE, decoded.length - IV_SIZE);
        } catch (AEADBadTagException e) {
            throw BillSyncException.invalid("Decryption failed: wrong key or tampered data.", e);
        } catch (GeneralSecurityException e) {
            throw BillSyncException.invalid("Decryption failed.", e);
        }
    }

    public String decryptToString(String ciphertext, SecretKey key) {
        return new String(decrypt(ciphertext, key), StandardCharsets.UTF_8);
    }

    // ── ECDSA ────────────────────────────────────────────────────────────────

    /** @return Base64 of the 96-byte r||s signature over the UTF-8 bytes of {@code data} */
    public String sign(String data, PrivateKey privateKey) {
        try {
            Signature signer = Signature.getInstance(SIGNATURE_ALGO, PROVIDER);
            signer.initSign(privateKey, random);
            signer.update(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("ECDSA signing failed", e);
        }
    }

    /**
     * False for a bad signature, a tampered message, the wrong key or malformed input. Never throws.
     */
    public boolean verify(String data, String signature, PublicKey publicKey) {
        if (data == null || signature == null || publicKey == null) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(SIGNATURE_ALGO, PROVIDER);
            verifier.initVerify(publicKey);
            verifier.update(data.getBytes(StandardCharsets.UTF_8));
            return verifier.verify(Base64Url.decode(signature));
        } catch (GeneralSecurityException | BillSyncException e) {
            return false;
        }
    }

    // ── JWK export / import ──────────────────────────────────────────────────

    public JsonWebKey exportKey(SecretKey key) {
        return JsonWebKey.symmetric(Base64Url.encode(key.getEncoded()));
    }

    public JsonWebKey exportKey(PublicKey key) {
        ECPoint w = ((ECPublicKey) key).getW();
        return JsonWebKey.ecPublic(JWK_CURVE, coordinate(w.getAffineX()), coordinate(w.getAffineY()));
    }

    /** Private JWK (with {@code d}); for local storage only, never for transport. */
    public JsonWebKey exportKey(KeyPair keyPair) {
        JsonWebKey publicJwk = exportKey(keyPair.getPublic());
        BigInteger d = ((ECPrivateKey) keyPair.getPrivate()).getS();
        return JsonWebKey.ecPrivate(JWK_CURVE, publicJwk.x(), publicJwk.y(), coordinate(d));
    }

    /**
     * @throws BillSyncException VALIDATION_FAILURE unless this is a 256-bit oct key
     */
    public SecretKey importContentKey(JsonWebKey jwk) {
        if (jwk == null || !"oct".equals(jwk.kty()) || jwk.k() == null) {
            throw BillSyncException.invalid("Not a symmetric key.");
        }
        byte[] raw = Base64Url.decode(jwk.k());
        if (raw.length != AES_KEY_BITS / 8) {
            throw BillSyncException.invalid("Symmetric key must be 256 bits.");
        }
        return new SecretKeySpec(raw, "AES");
    }

    public PublicKey importPublicKey(JsonWebKey jwk) {
        requireEcKey(jwk);
        ECPoint point = new ECPoint(unsigned(jwk.x()), unsigned(jwk.y()));
        try {
            return KeyFactory.getInstance("EC", PROVIDER).generatePublic(new ECPublicKeySpec(point, curveParameters()));
        } catch (GeneralSecurityException e) {
            throw BillSyncException.invalid("Public key is not a valid P-384 point.", e);
        }
    }

    public PrivateKey importPrivateKey(JsonWebKey jwk) {
        requireEcKey(jwk);
        if (jwk.d() == null) {
            throw BillSyncException.invalid("Key has no private part.");
        }
        try {
            return KeyFactory.getInstance("EC", PROVIDER)
                    .generatePrivate(new ECPrivateKeySpec(unsigned(jwk.d()), curveParameters()));
        } catch (GeneralSecurityException e) {
            throw BillSyncException.invalid("Private key is not valid for P-384.", e);
        }
    }

    /** Restores a full signing key pair from the owner's local private JWK. */
    public KeyPair importKeyPair(JsonWebKey privateJwk) {
        return new KeyPair(importPublicKey(privateJwk.publicOnly()), importPrivateKey(privateJwk));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static void requireEcKey(JsonWebKey jwk) {
        if (jwk == null || !"EC".equals(jwk.kty()) || !JWK_CURVE.equals(jwk.crv()) || jwk.x() == null || jwk.y() == null) {
            throw BillSyncException.invalid("Not a P-384 signing key.");
        }
    }

    private static ECParameterSpec curveParameters() throws GeneralSecurityException {
        AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC", PROVIDER);
        parameters.init(new ECGenParameterSpec(CURVE));
        return parameters.getParameterSpec(ECParameterSpec.class);
    }

    private static String coordinate(BigInteger value) {
        return Base64Url.encode(BigIntegers.asUnsignedByteArray(COORDINATE_BYTES, value));
    }

    private static BigInteger unsigned(String base64Url) {
        return BigIntegers.fromUnsignedByteArray(Base64Url.decode(base64Url));
    }
}
