package com.cgraph.e2ee.client.keys;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

/**
 * A device's long-term identity: the X25519 pair used in X3DH and the Ed25519
 * pair that signs prekeys. The private halves never leave the device.
 */
public record IdentityKeyPair(
        String keyId,
        X25519PrivateKeyParameters privateKey,
        X25519PublicKeyParameters publicKey,
        Ed25519PrivateKeyParameters signingPrivateKey,
        Ed25519PublicKeyParameters signingPublicKey
) {
}
