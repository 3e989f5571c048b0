package com.cgraph.e2ee.client.crypto;

import com.cgraph.e2ee.client.error.KeyAgreementException;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.generators.Ed25519KeyPairGenerator;
import org.bouncycastle.crypto.params.Ed25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Ed25519 signatures over signed prekeys.
 *
 * The identity carries a dedicated Ed25519 pair next to its X25519 pair, so the
 * signing role never shares key bytes with the Diffie-Hellman role.
 */
public final class PreKeySigner {

    public static final int SIGNATURE_LENGTH = Ed25519PrivateKeyParameters.SIGNATURE_SIZE;

    private static final SecureRandom RANDOM = new SecureRandom();

    private PreKeySigner() {
    }

    public static AsymmetricCipherKeyPair generateSigningKeyPair() {
        Ed25519KeyPairGenerator generator = new Ed25519KeyPairGenerator();
        generator.init(new Ed25519KeyGenerationParameters(RANDOM));
        return generator.generateKeyPair();
    }

    public static byte[] sign(Ed25519PrivateKeyParameters signingKey, byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, signingKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    public static boolean verify(Ed25519PublicKeyParameters verifyingKey, byte[] message, byte[] signature) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, verifyingKey);
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }

    public static String encodePublicKey(Ed25519PublicKeyParameters publicKey) {
        return Base64.getEncoder().encodeToString(publicKey.getEncoded());
    }

    public static String encodePrivateKey(Ed25519PrivateKeyParameters privateKey) {
        return Base64.getEncoder().encodeToString(privateKey.getEncoded());
    }

    public static Ed25519PublicKeyParameters decodePublicKey(String base64Key) {
        return new Ed25519PublicKeyParameters(Curve25519.decodeKeyBytes(base64Key, "signing key"), 0);
    }

    public static Ed25519PrivateKeyParameters decodePrivateKey(String base64Key) {
        return new Ed25519PrivateKeyParameters(Curve25519.decodeKeyBytes(base64Key, "signing private key"), 0);
    }

    public static byte[] decodeSignature(String base64Signature) {
        if (base64Signature == null || base64Signature.isBlank()) {
            throw new KeyAgreementException("Missing signed prekey signature");
        }
        try {
            return Base64.getDecoder().decode(base64Signature);
        } catch (IllegalArgumentException e) {
            throw new KeyAgreementException("Malformed signed prekey signature", e);
        }
    }
}
