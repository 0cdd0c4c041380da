package org.dgov.bc;

import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Hashing, key handling and ECDSA signatures for chain identities.
 * Requires the Bouncy Castle provider to be registered.
 */
public final class SignatureUtil {

    private static final String ALGORITHM = "SHA256withECDSA";
    private static final String PROVIDER = "BC";
    private static final int ADDRESS_BYTES = 20;

    private SignatureUtil() {
    }

    /**
     * Applies SHA-256 to the UTF-8 bytes of a string.
     *
     * @return the digest as 64 lowercase hex characters
     */
    public static String applySha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Hex.toHexString(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * Generates a new prime256v1 key pair.
     */
    public static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("ECDSA", PROVIDER);
            keyGen.initialize(new ECGenParameterSpec("prime256v1"), new SecureRandom());
            return keyGen.generateKeyPair();
        } catch (Exception e) {
            throw new IllegalStateException("Could not generate key pair", e);
        }
    }

    public static byte[] sign(PrivateKey privateKey, String data) {
        try {
            Signature ecdsa = Signature.getInstance(ALGORITHM, PROVIDER);
            ecdsa.initSign(privateKey);
            ecdsa.update(data.getBytes(StandardCharsets.UTF_8));
            return ecdsa.sign();
        } catch (Exception e) {
            throw new IllegalStateException("Could not sign data", e);
        }
    }

    /**
     * Verifies a signature. Malformed signatures verify as {@code false}.
     */
    public static boolean verify(PublicKey publicKey, byte[] signature, String data) {
        if (publicKey == null || signature == null || data == null) {
            return false;
        }
        try {
            Signature ecdsa = Signature.getInstance(ALGORITHM, PROVIDER);
            ecdsa.initVerify(publicKey);
            ecdsa.update(data.getBytes(StandardCharsets.UTF_8));
            return ecdsa.verify(signature);
        } catch (Exception e) {
            return false;
        }
    }

    /**
     * Base64 encoding of a key's standard encoded form.
     */
    public static String getStringFromKey(Key key) {
        return Base64.getEncoder().encodeToString(key.getEncoded());
    }

    public static PublicKey getPublicKeyFromString(String key) throws Exception {
        byte[] keyBytes = Base64.getDecoder().decode(key);
        KeyFactory keyFactory = KeyFactory.getInstance("ECDSA", PROVIDER);
        return keyFactory.generatePublic(new X509EncodedKeySpec(keyBytes));
    }

    public static PrivateKey getPrivateKeyFromString(String key) throws Exception {
        byte[] keyBytes = Base64.getDecoder().decode(key);
        KeyFactory keyFactory = KeyFactory.getInstance("ECDSA", PROVIDER);
        return keyFactory.generatePrivate(new PKCS8EncodedKeySpec(keyBytes));
    }

    /**
     * Derives a 20-byte address (40 hex characters) from a public key: the
     * trailing bytes of the SHA-256 of its encoded form.
     */
    public static String addressOf(PublicKey publicKey) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(publicKey.getEncoded());
            return Hex.toHexString(Arrays.copyOfRange(digest, digest.length - ADDRESS_BYTES, digest.length));
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
