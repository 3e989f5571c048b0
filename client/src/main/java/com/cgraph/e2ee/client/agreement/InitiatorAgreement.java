package com.cgraph.e2ee.client.agreement;

import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

/**
 * Result of the sending side of X3DH.
 *
 * @param oneTimePreKeyId id of the recipient's one-time prekey used for DH4, or
 *                        {@code null} when the bundle had none
 */
public record InitiatorAgreement(
        byte[] sharedSecret,
        X25519PublicKeyParameters ephemeralPublicKey,
        String oneTimePreKeyId
) {}
