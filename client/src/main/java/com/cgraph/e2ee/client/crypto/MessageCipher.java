package com.cgraph.e2ee.client.crypto;

import com.cgraph.e2ee.client.error.DecryptionFailureException;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;

/**
 * AES-256-GCM authenticated encryption of message bodies.
 *
 * A fresh random 96-bit nonce is drawn for every call. Nonce reuse stays out of
 * reach because every message is sealed under its own X3DH-derived key.
 */
public final class MessageCipher {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final int KEY_SIZE = 32;
    public static final int NONCE_SIZE = 12;
    private static final int TAG_SIZE = 128;
    private static final String AES_ALGO = "AES/GCM/NoPadding";

    private static final SecureRandom RANDOM = new SecureRandom();

    private MessageCipher() {
    }

    public static SealedPayload encrypt(byte[] plaintext, byte[] key) {
        requireKey(key);
        byte[] nonce = new byte[NONCE_SIZE];
        RANDOM.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE, nonce));
            return new SealedPayload(cipher.doFinal(plaintext), nonce);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM is unavailable", e);
        }
    }

    /**
     * Opens a payload sealed by {@link #encrypt}. Any tag mismatch, whether from a
     * wrong key, a flipped ciphertext bit or a flipped nonce bit, is reported as
     * {@link DecryptionFailureException}.
     */
    public static byte[] decrypt(byte[] ciphertext, byte[] nonce, byte[] key) {
        requireKey(key);
        if (nonce == null || nonce.length != NONCE_SIZE) {
            throw new DecryptionFailureException("Nonce must be " + NONCE_SIZE + " bytes");
        }
        if (ciphertext == null || ciphertext.length < TAG_SIZE / 8) {
            throw new DecryptionFailureException("Ciphertext is shorter than the authentication tag");
        }
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE, nonce));
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new DecryptionFailureException("Message authentication failed", e);
        }
    }

    private static void requireKey(byte[] key) {
        if (key == null || key.length != KEY_SIZE) {
            throw new IllegalArgumentException("AES-256 key must be " + KEY_SIZE + " bytes");
        }
    }
}
