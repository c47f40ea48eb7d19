package com.example.monitoring.codec;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-GCM sealing in the {@code nonce || ciphertext || tag} layout used by the wearable.
 * One instance per key; safe for concurrent use because a fresh {@link Cipher} is obtained per call.
 */
public final class AeadCipher {

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecretKey key;
    private final SecureRandom random;

    public AeadCipher(byte[] rawKey) {
        if (rawKey == null || (rawKey.length != 16 && rawKey.length != 24 && rawKey.length != 32)) {
            throw new IllegalArgumentException("AES key must be 128, 192 or 256 bits");
        }
        this.key = new SecretKeySpec(rawKey.clone(), "AES");
        this.random = new SecureRandom();
    }

    public static AeadCipher fromBase64(String encodedKey) {
        return new AeadCipher(Base64.getDecoder().decode(encodedKey.trim()));
    }

    public static byte[] generateKey() {
        byte[] raw = new byte[32];
        new SecureRandom().nextBytes(raw);
        return raw;
    }

    public byte[] seal(byte[] plaintext, byte[] associatedData) {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            if (associatedData != null) {
                cipher.updateAAD(associatedData);
            }
            byte[] body = cipher.doFinal(plaintext);
            return ByteBuffer.allocate(NONCE_LENGTH + body.length).put(nonce).put(body).array();
        } catch (GeneralSecurityException e) {
            // AES/GCM is mandatory on every JDK, so this is a broken runtime rather than bad input.
            throw new IllegalStateException("AES-GCM unavailable", e);
        }
    }

    /**
     * @throws GeneralSecurityException when the frame is too short, the tag does not verify
     *                                  or the associated data differs
     */
    public byte[] open(byte[] sealed, byte[] associatedData) throws GeneralSecurityException {
        if (sealed == null || sealed.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new GeneralSecurityException("sealed frame shorter than nonce and tag");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, sealed, 0, NONCE_LENGTH));
        if (associatedData != null) {
            cipher.updateAAD(associatedData);
        }
        return cipher.doFinal(sealed, NONCE_LENGTH, sealed.length - NONCE_LENGTH);
    }
}
