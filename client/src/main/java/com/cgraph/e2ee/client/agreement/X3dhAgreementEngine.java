package com.cgraph.e2ee.client.agreement;

import com.cgraph.e2ee.client.crypto.Curve25519;
import com.cgraph.e2ee.client.crypto.Hkdf;
import com.cgraph.e2ee.client.crypto.PreKeySigner;
import com.cgraph.e2ee.client.error.KeyAgreementException;
import com.cgraph.e2ee.client.keys.IdentityKeyPair;
import com.cgraph.e2ee.client.keys.SignedPreKey;
import com.cgraph.e2ee.client.wire.ServerPrekeyBundle;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.util.Arrays;

import java.nio.charset.StandardCharsets;

/**
 * Extended Triple Diffie-Hellman key agreement.
 *
 * <pre>
 *   DH1 = DH(IK_A, SPK_B)
 *   DH2 = DH(EK_A, IK_B)
 *   DH3 = DH(EK_A, SPK_B)
 *   DH4 = DH(EK_A, OPK_B)     only when a one-time prekey is used
 *   SK  = HKDF-SHA256(DH1 || DH2 || DH3 [|| DH4], salt = 0^32, info = "CGraph E2EE v1")
 * </pre>
 *
 * Both sides concatenate in this order, so they arrive at the same 32-byte key.
 * The engine is stateless and thread-safe.
 */
public class X3dhAgreementEngine {

    public static final int SHARED_SECRET_LENGTH = 32;

    private static final byte[] SALT = new byte[32];
    private static final byte[] INFO = "CGraph E2EE v1".getBytes(StandardCharsets.UTF_8);

    /**
     * Sender side. Verifies the signed prekey against the bundle's signing key
     * before computing anything.
     */
    public InitiatorAgreement initiate(IdentityKeyPair ourIdentity, ServerPrekeyBundle theirBundle) {
        X25519PublicKeyParameters theirIdentity = Curve25519.decodePublicKey(theirBundle.identityKey());
        X25519PublicKeyParameters theirSignedPreKey = Curve25519.decodePublicKey(theirBundle.signedPrekey());
        Ed25519PublicKeyParameters theirSigningKey = PreKeySigner.decodePublicKey(theirBundle.signingKey());
        byte[] signature = PreKeySigner.decodeSignature(theirBundle.signedPrekeySignature());
        if (!PreKeySigner.verify(theirSigningKey, theirSignedPreKey.getEncoded(), signature)) {
            throw new KeyAgreementException("Signed prekey signature does not verify");
        }
        X25519PublicKeyParameters theirOneTimePreKey = theirBundle.hasOneTimePreKey()
                ? Curve25519.decodePublicKey(theirBundle.oneTimePrekey())
                : null;

        AsymmetricCipherKeyPair ephemeral = Curve25519.generateKeyPair();
        X25519PrivateKeyParameters ephemeralPrivate = (X25519PrivateKeyParameters) ephemeral.getPrivate();

        byte[] dh1 = Curve25519.calculateAgreement(ourIdentity.privateKey(), theirSignedPreKey);
        byte[] dh2 = Curve25519.calculateAgreement(ephemeralPrivate, theirIdentity);
        byte[] dh3 = Curve25519.calculateAgreement(ephemeralPrivate, theirSignedPreKey);
        byte[] dh4 = theirOneTimePreKey == null ? null : Curve25519.calculateAgreement(ephemeralPrivate, theirOneTimePreKey);

        return new InitiatorAgreement(
                derive(dh1, dh2, dh3, dh4),
                (X25519PublicKeyParameters) ephemeral.getPublic(),
                theirOneTimePreKey == null ? null : theirBundle.oneTimePrekeyId());
    }

    /**
     * Receiver side.
     *
     * @param ourOneTimePreKey private half named by the message, or {@code null}
     *                         when the sender used none
     */
    public byte[] respond(IdentityKeyPair ourIdentity,
                          SignedPreKey ourSignedPreKey,
                          X25519PrivateKeyParameters ourOneTimePreKey,
                          X25519PublicKeyParameters theirIdentityKey,
                          X25519PublicKeyParameters theirEphemeralKey) {
        byte[] dh1 = Curve25519.calculateAgreement(ourSignedPreKey.privateKey(), theirIdentityKey);
        byte[] dh2 = Curve25519.calculateAgreement(ourIdentity.privateKey(), theirEphemeralKey);
        byte[] dh3 = Curve25519.calculateAgreement(ourSignedPreKey.privateKey(), theirEphemeralKey);
        byte[] dh4 = ourOneTimePreKey == null ? null : Curve25519.calculateAgreement(ourOneTimePreKey, theirEphemeralKey);
        return derive(dh1, dh2, dh3, dh4);
    }

    /** Derives the shared secret and zeroes every DH output and the concatenated input. */
    static byte[] derive(byte[] dh1, byte[] dh2, byte[] dh3, byte[] dh4) {
        byte[] material = dh4 == null ? Arrays.concatenate(dh1, dh2, dh3) : Arrays.concatenate(dh1, dh2, dh3, dh4);
        try {
            return Hkdf.deriveSecret(material, SALT, INFO, SHARED_SECRET_LENGTH);
        } catch (RuntimeException e) {
            throw new KeyAgreementException("Key derivation failed", e);
        } finally {
            wipe(material);
            wipe(dh1);
            wipe(dh2);
            wipe(dh3);
            wipe(dh4);
        }
    }

    private static void wipe(byte[] secret) {
        if (secret != null) {
            java.util.Arrays.fill(secret, (byte) 0);
        }
    }
}
