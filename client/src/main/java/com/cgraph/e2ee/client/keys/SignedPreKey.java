package com.cgraph.e2ee.client.keys;

import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

/** Medium-term X25519 prekey with the identity's Ed25519 signature over its raw public key. */
public record SignedPreKey(
        String keyId,
        X25519PrivateKeyParameters privateKey,
        X25519PublicKeyParameters publicKey,
        byte[] signature
) {
}
