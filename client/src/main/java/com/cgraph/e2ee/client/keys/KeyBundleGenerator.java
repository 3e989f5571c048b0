package com.cgraph.e2ee.client.keys;

import com.cgraph.e2ee.client.crypto.Curve25519;
import com.cgraph.e2ee.client.crypto.PreKeySigner;
import com.cgraph.e2ee.client.error.SetupException;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.util.encoders.Hex;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * Generates identity keys, signed prekeys and batches of one-time prekeys.
 *
 * <p>Random source failures are fatal: they surface as {@link SetupException}
 * and are never retried here.
 */
public class KeyBundleGenerator {

    public static final int DEFAULT_ONE_TIME_PREKEYS = 100;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Supplier<String> keyIds;
    private final Clock clock;

    public KeyBundleGenerator() {
        this(KeyBundleGenerator::randomKeyId, Clock.systemUTC());
    }

    public KeyBundleGenerator(Supplier<String> keyIds, Clock clock) {
        this.keyIds = keyIds;
        this.clock = clock;
    }

    /** 8 random bytes as 16 lowercase hex characters. */
    public static String randomKeyId() {
        return Hex.toHexString(randomBytes(8));
    }

    /** {@code <platform>_<8 hex>_<epoch millis>}. */
    public String generateDeviceId(String platform) {
        return platform + "_" + Hex.toHexString(randomBytes(4)) + "_" + clock.millis();
    }

    public IdentityKeyPair generateIdentityKeyPair() {
        try {
            AsymmetricCipherKeyPair dh = Curve25519.generateKeyPair();
            AsymmetricCipherKeyPair signing = PreKeySigner.generateSigningKeyPair();
            return new IdentityKeyPair(
                    keyIds.get(),
                    (X25519PrivateKeyParameters) dh.getPrivate(),
                    (X25519PublicKeyParameters) dh.getPublic(),
                    (Ed25519PrivateKeyParameters) signing.getPrivate(),
                    (Ed25519PublicKeyParameters) signing.getPublic());
        } catch (RuntimeException e) {
            throw new SetupException("Could not generate identity key pair", e);
        }
    }

    public SignedPreKey generateSignedPreKey(IdentityKeyPair identity) {
        try {
            AsymmetricCipherKeyPair pair = Curve25519.generateKeyPair();
            X25519PublicKeyParameters publicKey = (X25519PublicKeyParameters) pair.getPublic();
            byte[] signature = PreKeySigner.sign(identity.signingPrivateKey(), publicKey.getEncoded());
            return new SignedPreKey(keyIds.get(), (X25519PrivateKeyParameters) pair.getPrivate(), publicKey, signature);
        } catch (RuntimeException e) {
            throw new SetupException("Could not generate signed prekey", e);
        }
    }

    public OneTimePreKey generateOneTimePreKey() {
        try {
            AsymmetricCipherKeyPair pair = Curve25519.generateKeyPair();
            return new OneTimePreKey(
                    keyIds.get(),
                    (X25519PrivateKeyParameters) pair.getPrivate(),
                    (X25519PublicKeyParameters) pair.getPublic());
        } catch (RuntimeException e) {
            throw new SetupException("Could not generate one-time prekey", e);
        }
    }

    /** Generates {@code count} independent one-time prekeys on the parallel scheduler. */
    public Mono<List<OneTimePreKey>> generateOneTimePreKeys(int count) {
        if (count < 0) {
            return Mono.error(new IllegalArgumentException("count must not be negative"));
        }
        return Flux.range(0, count)
                .parallel()
                .runOn(Schedulers.parallel())
                .map(i -> generateOneTimePreKey())
                .sequential()
                .collectList();
    }

    public Mono<KeyBundle> generateKeyBundle(String deviceId) {
        return generateKeyBundle(deviceId, DEFAULT_ONE_TIME_PREKEYS);
    }

    public Mono<KeyBundle> generateKeyBundle(String deviceId, int oneTimePreKeyCount) {
        return Mono.fromCallable(this::generateIdentityKeyPair)
                .subscribeOn(Schedulers.parallel())
                .flatMap(identity -> {
                    SignedPreKey signedPreKey = generateSignedPreKey(identity);
                    return generateOneTimePreKeys(oneTimePreKeyCount)
                            .map(prekeys -> new KeyBundle(deviceId, identity, signedPreKey, prekeys));
                });
    }

    private static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        try {
            RANDOM.nextBytes(bytes);
        } catch (RuntimeException e) {
            throw new SetupException("Secure random source failed", e);
        }
        return bytes;
    }
}
