package com.cgraph.e2ee.client.keys;

import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

/** Single-use X25519 prekey. Answers at most one exchange. */
public record OneTimePreKey(
        String keyId,
        X25519PrivateKeyParameters privateKey,
        X25519PublicKeyParameters publicKey
) {
}
