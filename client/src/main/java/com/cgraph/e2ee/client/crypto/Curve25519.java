package com.cgraph.e2ee.client.crypto;

import com.cgraph.e2ee.client.error.KeyAgreementException;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.generators.X25519KeyPairGenerator;
import org.bouncycastle.crypto.params.X25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * X25519 key generation, Diffie-Hellman and the Base64 wire encoding of keys.
 *
 * Every key on the wire is the raw 32-byte X25519 encoding, Base64 (standard
 * alphabet, padded). Decoding failures surface as {@link KeyAgreementException}
 * because a bad remote key can only ever break one exchange.
 */
public final class Curve25519 {

    public static final int KEY_LENGTH = X25519PublicKeyParameters.KEY_SIZE;

    private static final SecureRandom RANDOM = new SecureRandom();

    private Curve25519() {
    }

    public static AsymmetricCipherKeyPair generateKeyPair() {
        X25519KeyPairGenerator generator = new X25519KeyPairGenerator();
        generator.init(new X25519KeyGenerationParameters(RANDOM));
        return generator.generateKeyPair();
    }

    /**
     * Raw X25519 agreement. Rejects low-order remote points, which BouncyCastle
     * reports as an all-zero result.
     */
    public static byte[] calculateAgreement(X25519PrivateKeyParameters privateKey,
                                            X25519PublicKeyParameters publicKey) {
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(privateKey);
        byte[] secret = new byte[agreement.getAgreementSize()];
        try {
            agreement.calculateAgreement(publicKey, secret, 0);
        } catch (IllegalStateException e) {
            throw new KeyAgreementException("X25519 agreement produced an invalid shared value", e);
        }
        return secret;
    }

    public static String encodePublicKey(X25519PublicKeyParameters publicKey) {
        return Base64.getEncoder().encodeToString(publicKey.getEncoded());
    }

    public static String encodePrivateKey(X25519PrivateKeyParameters privateKey) {
        return Base64.getEncoder().encodeToString(privateKey.getEncoded());
    }

    public static X25519PublicKeyParameters decodePublicKey(String base64Key) {
        return new X25519PublicKeyParameters(decodeKeyBytes(base64Key, "public key"), 0);
    }

    public static X25519PrivateKeyParameters decodePrivateKey(String base64Key) {
        return new X25519PrivateKeyParameters(decodeKeyBytes(base64Key, "private key"), 0);
    }

    /** Decodes a Base64 value that must hold exactly {@link #KEY_LENGTH} bytes. */
    public static byte[] decodeKeyBytes(String base64Key, String description) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new KeyAgreementException("Missing " + description);
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(base64Key);
        } catch (IllegalArgumentException e) {
            throw new KeyAgreementException("Malformed " + description + ": not Base64", e);
        }
        if (bytes.length != KEY_LENGTH) {
            throw new KeyAgreementException(
                    "Malformed " + description + ": expected " + KEY_LENGTH + " bytes, got " + bytes.length);
        }
        return bytes;
    }
}
