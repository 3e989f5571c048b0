package com.cgraph.e2ee.client.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.StringJoiner;

/**
 * Safety numbers: a 60-digit code two users compare out of band to detect a
 * man in the middle.
 *
 * <p>The (user id, identity key) pairs are ordered by user id, then by key bytes,
 * before hashing, so both parties compute the same code whichever side asks.
 */
public final class SafetyNumberGenerator {

    private static final int GROUPS = 12;

    private SafetyNumberGenerator() {
    }

    public static String generate(String userA, byte[] identityKeyA, String userB, byte[] identityKeyB) {
        int byUser = userA.compareTo(userB);
        // two devices of one user: order by key so both sides agree
        boolean aFirst = byUser != 0 ? byUser < 0 : Arrays.compareUnsigned(identityKeyA, identityKeyB) <= 0;
        ByteArrayOutputStream combined = new ByteArrayOutputStream();
        if (aFirst) {
            append(combined, userA, identityKeyA);
            append(combined, userB, identityKeyB);
        } else {
            append(combined, userB, identityKeyB);
            append(combined, userA, identityKeyA);
        }

        byte[] digest = sha256(combined.toByteArray());
        StringJoiner code = new StringJoiner(" ");
        for (int i = 0; i < GROUPS; i++) {
            int value = ((digest[i * 2] & 0xff) << 8) | (digest[i * 2 + 1] & 0xff);
            code.add(String.format("%05d", value));
        }
        return code.toString();
    }

    /** Lowercase hex SHA-256 of a raw public key. */
    public static String fingerprint(byte[] publicKey) {
        return Hex.toHexString(sha256(publicKey));
    }

    private static void append(ByteArrayOutputStream out, String userId, byte[] identityKey) {
        out.writeBytes(userId.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(identityKey);
    }

    private static byte[] sha256(byte[] input) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
