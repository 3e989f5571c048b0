package com.cgraph.e2ee.client.session;

import com.cgraph.e2ee.client.agreement.InitiatorAgreement;
import com.cgraph.e2ee.client.agreement.X3dhAgreementEngine;
import com.cgraph.e2ee.client.crypto.Curve25519;
import com.cgraph.e2ee.client.crypto.MessageCipher;
import com.cgraph.e2ee.client.crypto.SafetyNumberGenerator;
import com.cgraph.e2ee.client.crypto.SealedPayload;
import com.cgraph.e2ee.client.device.ActiveDevice;
import com.cgraph.e2ee.client.device.DeviceLifecycleManager;
import com.cgraph.e2ee.client.device.PrekeyReplenisher;
import com.cgraph.e2ee.client.directory.KeyDirectoryClient;
import com.cgraph.e2ee.client.directory.PrekeyBundleCache;
import com.cgraph.e2ee.client.error.DecryptionFailureException;
import com.cgraph.e2ee.client.error.E2eeException;
import com.cgraph.e2ee.client.error.KeyAgreementException;
import com.cgraph.e2ee.client.error.SetupException;
import com.cgraph.e2ee.client.keys.DeviceKeys;
import com.cgraph.e2ee.client.keys.KeyBundle;
import com.cgraph.e2ee.client.keys.KeyBundleGenerator;
import com.cgraph.e2ee.client.store.LocalKeyStore;
import com.cgraph.e2ee.client.store.OneTimePreKeyStore;
import com.cgraph.e2ee.client.wire.BundleFormatter;
import com.cgraph.e2ee.client.wire.DeviceInfo;
import com.cgraph.e2ee.client.wire.EncryptedMessage;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * End-to-end encryption for one logged-in user on this device.
 *
 * <p>Every message runs a full X3DH exchange against a freshly fetched bundle and
 * is sealed with AES-256-GCM under the derived key. Nothing is sent in clear: any
 * failure is signalled as an {@link E2eeException} subclass and the caller decides
 * what to tell the user.
 *
 * <p>Instances are built by {@link E2eeSessionFactory}.
 */
public class E2eeSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(E2eeSession.class);

    static final String PLATFORM = "jvm";

    private final String userId;
    private final int oneTimePreKeyBatch;
    private final KeyBundleGenerator generator;
    private final LocalKeyStore keyStore;
    private final KeyDirectoryClient directory;
    private final PrekeyBundleCache bundleCache;
    private final X3dhAgreementEngine agreement;
    private final PrekeyReplenisher replenisher;
    private final DeviceLifecycleManager devices;
    private final ActiveDevice activeDevice;

    E2eeSession(String userId,
                int oneTimePreKeyBatch,
                KeyBundleGenerator generator,
                LocalKeyStore keyStore,
                KeyDirectoryClient directory,
                PrekeyBundleCache bundleCache,
                X3dhAgreementEngine agreement,
                PrekeyReplenisher replenisher,
                DeviceLifecycleManager devices,
                ActiveDevice activeDevice) {
        this.userId = userId;
        this.oneTimePreKeyBatch = oneTimePreKeyBatch;
        this.generator = generator;
        this.keyStore = keyStore;
        this.directory = directory;
        this.bundleCache = bundleCache;
        this.agreement = agreement;
        this.replenisher = replenisher;
        this.devices = devices;
        this.activeDevice = activeDevice;
    }

    public String userId() {
        return userId;
    }

    /**
     * First-time setup: generate a bundle, persist it, publish its public half.
     * If publishing fails the local record is removed again.
     *
     * @return the new device id
     */
    public Mono<String> setup() {
        return Mono.defer(() -> {
            String deviceId = generator.generateDeviceId(PLATFORM);
            return generator.generateKeyBundle(deviceId, oneTimePreKeyBatch)
                    .flatMap(bundle -> keyStore.save(bundle).then(publish(bundle)))
                    .map(bundle -> {
                        activeDevice.activate(DeviceKeys.of(bundle));
                        replenisher.start(deviceId);
                        LOGGER.info("E2EE set up for user {} on device {}", userId, deviceId);
                        return deviceId;
                    });
        });
    }

    private Mono<KeyBundle> publish(KeyBundle bundle) {
        return directory.register(BundleFormatter.formatForRegistration(bundle))
                .thenReturn(bundle)
                .onErrorResume(e -> keyStore.clear()
                        .then(Mono.error(new SetupException("Could not publish keys for device " + bundle.deviceId(), e))));
    }

    /**
     * Loads keys saved by an earlier {@link #setup()}. Emits {@code false} when this
     * device has none.
     */
    public Mono<Boolean> initialize() {
        return keyStore.load()
                .map(keys -> {
                    activeDevice.activate(keys);
                    replenisher.start(keys.deviceId());
                    replenisher.onForeground();
                    LOGGER.info("E2EE initialized for user {} on device {}", userId, keys.deviceId());
                    return true;
                })
                .defaultIfEmpty(false);
    }

    public boolean isInitialized() {
        return activeDevice.isInitialized();
    }

    public Optional<String> deviceId() {
        return activeDevice.current().map(DeviceKeys::deviceId);
    }

    /** This device's public identity key, Base64; what senders pass to {@link #decryptMessage}. */
    public String identityKey() {
        return Curve25519.encodePublicKey(activeDevice.require().identityKey().publicKey());
    }

    public Mono<EncryptedMessage> encryptMessage(String recipientId, String plaintext) {
        return Mono.defer(() -> {
            DeviceKeys ours = activeDevice.require();
            return bundleCache.acquireForEncryption(recipientId)
                    .map(bundle -> {
                        InitiatorAgreement exchange = agreement.initiate(ours.identityKey(), bundle);
                        byte[] key = exchange.sharedSecret();
                        try {
                            SealedPayload sealed = MessageCipher.encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
                            LOGGER.debug("Encrypted message to {} (one-time prekey: {})",
                                    recipientId, exchange.oneTimePreKeyId() != null);
                            return new EncryptedMessage(
                                    Base64.getEncoder().encodeToString(sealed.ciphertext()),
                                    Curve25519.encodePublicKey(exchange.ephemeralPublicKey()),
                                    bundle.identityKeyId(),
                                    exchange.oneTimePreKeyId(),
                                    Base64.getEncoder().encodeToString(sealed.nonce()));
                        } finally {
                            Arrays.fill(key, (byte) 0);
                        }
                    });
        });
    }

    /**
     * Opens a message sent to this device. A one-time prekey named by the message
     * is used up only after the message authenticates, so a forged message cannot
     * burn it; a second message naming the same key fails.
     */
    public Mono<String> decryptMessage(String senderId, String senderIdentityKey, EncryptedMessage message) {
        return Mono.defer(() -> {
            DeviceKeys ours = activeDevice.require();
            String ourKeyId = ours.identityKey().keyId();
            if (message.recipientIdentityKeyId() != null && !message.recipientIdentityKeyId().equals(ourKeyId)) {
                return Mono.error(new KeyAgreementException(
                        "Message was sealed for identity key " + message.recipientIdentityKeyId()));
            }
            X25519PublicKeyParameters theirIdentity = Curve25519.decodePublicKey(senderIdentityKey);
            X25519PublicKeyParameters theirEphemeral = Curve25519.decodePublicKey(message.ephemeralPublicKey());
            byte[] ciphertext = decodeBase64(message.ciphertext(), "ciphertext");
            byte[] nonce = decodeBase64(message.nonce(), "nonce");
            String prekeyId = message.oneTimePrekeyId();

            return findOneTimePreKey(prekeyId)
                    .map(prekey -> {
                        byte[] key = agreement.respond(ours.identityKey(), ours.signedPreKey(),
                                prekey.orElse(null), theirIdentity, theirEphemeral);
                        try {
                            return MessageCipher.decrypt(ciphertext, nonce, key);
                        } finally {
                            Arrays.fill(key, (byte) 0);
                        }
                    })
                    .flatMap(plaintext -> consumeOneTimePreKey(prekeyId)
                            .thenReturn(new String(plaintext, StandardCharsets.UTF_8)))
                    .doOnNext(ignored -> LOGGER.debug("Decrypted message from {}", senderId));
        });
    }

    private Mono<Optional<X25519PrivateKeyParameters>> findOneTimePreKey(String prekeyId) {
        if (prekeyId == null) {
            return Mono.just(Optional.empty());
        }
        return keyStore.oneTimePreKeys().find(prekeyId)
                .map(Optional::of)
                .switchIfEmpty(Mono.error(() -> new KeyAgreementException(
                        "One-time prekey " + prekeyId + " is unknown or already used")));
    }

    private Mono<Void> consumeOneTimePreKey(String prekeyId) {
        if (prekeyId == null) {
            return Mono.empty();
        }
        OneTimePreKeyStore prekeys = keyStore.oneTimePreKeys();
        return prekeys.consume(prekeyId)
                .switchIfEmpty(Mono.error(() -> new KeyAgreementException(
                        "One-time prekey " + prekeyId + " was used by a concurrent message")))
                .then();
    }

    /** Safety number with {@code otherUserId}; consumes none of their prekeys. */
    public Mono<String> getSafetyNumber(String otherUserId) {
        return Mono.defer(() -> {
            byte[] ourKey = activeDevice.require().identityKey().publicKey().getEncoded();
            return directory.fetchIdentityKey(otherUserId)
                    .map(record -> SafetyNumberGenerator.generate(userId, ourKey, otherUserId,
                            Curve25519.decodeKeyBytes(record.identityKey(), "identity key")));
        });
    }

    /** Lowercase hex SHA-256 of this device's identity key. */
    public String fingerprint() {
        return SafetyNumberGenerator.fingerprint(activeDevice.require().identityKey().publicKey().getEncoded());
    }

    public Flux<DeviceInfo> listDevices() {
        return devices.listDevices();
    }

    public Mono<Void> revokeDevice(String deviceId) {
        return devices.revokeDevice(deviceId);
    }

    /** Keeps the supply of one-time prekeys topped up after the app resumes. */
    public void onForeground() {
        replenisher.onForeground();
    }

    /**
     * Drops this device's keys: revoke them on the directory when reachable, then
     * wipe them locally regardless.
     */
    public Mono<Void> reset() {
        return Mono.defer(() -> {
            Optional<String> deviceId = deviceId();
            Mono<Void> revoke = deviceId
                    .map(id -> directory.revokeDevice(id)
                            .onErrorResume(e -> {
                                LOGGER.warn("Could not revoke device {} during reset: {}", id, e.getMessage());
                                return Mono.empty();
                            }))
                    .orElseGet(Mono::empty);
            return revoke.then(devices.wipeLocalDevice());
        });
    }

    /** Stops background work and drops caches. Keys stay on the device. */
    public void logout() {
        replenisher.stop();
        bundleCache.clear();
        activeDevice.deactivate();
        LOGGER.info("E2EE session closed for user {}", userId);
    }

    private static byte[] decodeBase64(String value, String description) {
        if (value == null) {
            throw new DecryptionFailureException("Missing " + description);
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new DecryptionFailureException("Malformed " + description, e);
        }
    }
}
