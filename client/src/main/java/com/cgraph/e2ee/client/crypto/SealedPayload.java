package com.cgraph.e2ee.client.crypto;

/**
 * Output of {@link MessageCipher#encrypt}: ciphertext with the 16-byte GCM tag
 * appended, and the 12-byte nonce it was sealed under.
 */
public record SealedPayload(byte[] ciphertext, byte[] nonce) {
}
