package com.cgraph.e2ee.client.crypto;

import org.junit.jupiter.api.Test;

import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;

class SafetyNumberGeneratorTest {

    private static final SecureRandom RANDOM = new SecureRandom();

    private static byte[] key() {
        byte[] key = new byte[32];
        RANDOM.nextBytes(key);
        return key;
    }

    @Test
    void bothPartiesComputeTheSameNumber() {
        byte[] aliceKey = key();
        byte[] bobKey = key();

        String fromAlice = SafetyNumberGenerator.generate("alice", aliceKey, "bob", bobKey);
        String fromBob = SafetyNumberGenerator.generate("bob", bobKey, "alice", aliceKey);

        assertEquals(fromAlice, fromBob);
    }

    @Test
    void twoDevicesOfOneUserAgree() {
        byte[] laptopKey = key();
        byte[] phoneKey = key();

        String fromLaptop = SafetyNumberGenerator.generate("alice", laptopKey, "alice", phoneKey);
        String fromPhone = SafetyNumberGenerator.generate("alice", phoneKey, "alice", laptopKey);

        assertEquals(fromLaptop, fromPhone);
    }

    @Test
    void isDeterministicAndFormattedAsTwelveGroupsOfFive() {
        byte[] aliceKey = key();
        byte[] bobKey = key();

        String number = SafetyNumberGenerator.generate("alice", aliceKey, "bob", bobKey);

        assertEquals(number, SafetyNumberGenerator.generate("alice", aliceKey, "bob", bobKey));
        assertTrue(number.matches("(\\d{5} ){11}\\d{5}"), number);
        assertEquals(60, number.replace(" ", "").length());
    }

    @Test
    void changesWhenEitherIdentityKeyChanges() {
        byte[] aliceKey = key();
        byte[] bobKey = key();

        String original = SafetyNumberGenerator.generate("alice", aliceKey, "bob", bobKey);

        assertNotEquals(original, SafetyNumberGenerator.generate("alice", key(), "bob", bobKey));
        assertNotEquals(original, SafetyNumberGenerator.generate("alice", aliceKey, "bob", key()));
    }

    @Test
    void fingerprintIsLowercaseHexSha256() {
        String fingerprint = SafetyNumberGenerator.fingerprint(key());

        assertTrue(fingerprint.matches("[0-9a-f]{64}"), fingerprint);
        // SHA-256 of 32 zero bytes
        assertEquals("66687aadf862bd776c8fc18b8e9f8e20089714856ee233b3902a591d0d5f2925",
                SafetyNumberGenerator.fingerprint(new byte[32]));
    }
}
