package com.cgraph.e2ee.directory;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Base64;

/**
 * Shape checks for uploaded public key material. Every failure is a 422 naming
 * the offending field.
 */
public final class KeyMaterial {

    public static final int KEY_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 64;

    private KeyMaterial() {
    }

    /** Base64 of exactly 32 raw bytes. */
    public static byte[] requireKey(String field, String base64) {
        byte[] bytes = decode(field, base64);
        if (bytes.length != KEY_LENGTH) {
            throw invalid(field + " must be " + KEY_LENGTH + " bytes, got " + bytes.length);
        }
        return bytes;
    }

    public static byte[] requireSignature(String field, String base64) {
        byte[] bytes = decode(field, base64);
        if (bytes.length != SIGNATURE_LENGTH) {
            throw invalid(field + " must be " + SIGNATURE_LENGTH + " bytes, got " + bytes.length);
        }
        return bytes;
    }

    public static String requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw invalid(field + " is required");
        }
        return value;
    }

    /** Ed25519 verification of {@code signature} over {@code message}. */
    public static void requireValidSignature(byte[] signingKey, byte[] message, byte[] signature) {
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, new Ed25519PublicKeyParameters(signingKey, 0));
        verifier.update(message, 0, message.length);
        if (!verifier.verifySignature(signature)) {
            throw invalid("signed_prekey signature does not verify under signing_key");
        }
    }

    private static byte[] decode(String field, String base64) {
        if (base64 == null || base64.isBlank()) {
            throw invalid(field + " is required");
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, field + " is not valid Base64", e);
        }
    }

    private static ResponseStatusException invalid(String reason) {
        return new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, reason);
    }
}
