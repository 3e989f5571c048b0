package com.cgraph.e2ee.directory.device;

import com.cgraph.e2ee.directory.KeyMaterial;
import com.cgraph.e2ee.directory.prekey.OneTimePrekeyEntity;
import com.cgraph.e2ee.directory.prekey.PrekeyRequest;
import com.cgraph.e2ee.directory.prekey.PrekeyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Registration, lookup and revocation of device keys.
 *
 * <p>Senders always get the bundle of the user's most recently registered
 * device. Handing out a bundle consumes one of that device's one-time prekeys;
 * the identity lookup consumes nothing.
 *
 * <p><strong>Identity key change:</strong> a device re-registering with a
 * different identity key is logged at WARN and loses its verified flag, so
 * contacts are asked to compare safety numbers again.
 */
@Service
public class DeviceKeyService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeviceKeyService.class);

    private static final Comparator<DeviceKeysEntity> BY_CREATED =
            Comparator.comparing(DeviceKeysEntity::getCreatedAt);

    private final DeviceKeysRepository repository;
    private final PrekeyService prekeyService;
    private final Clock clock;

    public DeviceKeyService(DeviceKeysRepository repository, PrekeyService prekeyService, Clock clock) {
        this.repository = repository;
        this.prekeyService = prekeyService;
        this.clock = clock;
    }

    /**
     * Stores the public half of a device's bundle. The caller's {@code userId}
     * comes from the gateway; the device id from the payload.
     */
    public Mono<RegistrationResponse> register(String userId, RegistrationRequest request) {
        return Mono.defer(() -> {
            List<PrekeyRequest> prekeys = validate(request);
            DeviceKeysKey key = new DeviceKeysKey(userId, request.deviceId());
            Instant now = clock.instant();
            return repository.findById(key)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(existing -> repository.save(toEntity(key, request, existing, now)))
                    .flatMap(saved -> prekeyService.replaceAll(userId, request.deviceId(), prekeys))
                    .map(count -> {
                        LOGGER.info("Registered device {} of {} with {} one-time prekeys",
                                request.deviceId(), userId, count);
                        return new RegistrationResponse(request.keyId(), request.signedPrekey().keyId(), count);
                    });
        });
    }

    /** Bundle of the user's newest device, claiming one one-time prekey if any are left. */
    public Mono<BundleResponse> bundle(String userId) {
        return newestDevice(userId)
                .flatMap(device -> prekeyService.consumeOne(userId, device.getKey().deviceId())
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty())
                        .map(prekey -> toBundle(device, prekey.orElse(null))));
    }

    public Mono<IdentityKeyResponse> identityKey(String userId) {
        return newestDevice(userId)
                .map(device -> new IdentityKeyResponse(userId, device.getKey().deviceId(),
                        device.getIdentityKey(), device.getIdentityKeyId()));
    }

    public Flux<DeviceResponse> devices(String userId) {
        return repository.findAllByKeyUserId(userId)
                .sort(BY_CREATED)
                .map(device -> new DeviceResponse(device.getKey().deviceId(), device.getCreatedAt()));
    }

    /** Deletes a device's keys and its remaining one-time prekeys. */
    public Mono<Void> revoke(String userId, String deviceId) {
        DeviceKeysKey key = new DeviceKeysKey(userId, deviceId);
        return repository.findById(key)
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Device not registered: " + deviceId)))
                .flatMap(device -> repository.delete(device))
                .then(Mono.defer(() -> prekeyService.deleteAll(userId, deviceId)))
                .doOnSuccess(done -> LOGGER.info("Revoked device {} of {}", deviceId, userId));
    }

    private Mono<DeviceKeysEntity> newestDevice(String userId) {
        return repository.findAllByKeyUserId(userId)
                .reduce((a, b) -> BY_CREATED.compare(a, b) >= 0 ? a : b)
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No keys registered for user " + userId)));
    }

    private DeviceKeysEntity toEntity(DeviceKeysKey key, RegistrationRequest request,
                                      Optional<DeviceKeysEntity> existing, Instant now) {
        DeviceKeysEntity entity = existing.orElseGet(DeviceKeysEntity::new);
        if (existing.isPresent() && !existing.get().getIdentityKey().equals(request.identityKey())) {
            LOGGER.warn("SECURITY: identity key of device {} of {} changed from {} to {}",
                    key.deviceId(), key.userId(), existing.get().getIdentityKeyId(), request.keyId());
            entity.setVerified(false);
        }
        if (existing.isEmpty()) {
            entity.setKey(key);
            entity.setCreatedAt(now);
        }
        entity.setIdentityKey(request.identityKey());
        entity.setIdentityKeyId(request.keyId());
        entity.setSigningKey(request.signingKey());
        entity.setSignedPrekey(request.signedPrekey().publicKey());
        entity.setSignedPrekeyId(request.signedPrekey().keyId());
        entity.setSignedPrekeySignature(request.signedPrekey().signature());
        entity.setUpdatedAt(now);
        return entity;
    }

    private static BundleResponse toBundle(DeviceKeysEntity device, OneTimePrekeyEntity prekey) {
        return new BundleResponse(
                device.getIdentityKey(),
                device.getIdentityKeyId(),
                device.getSigningKey(),
                device.getKey().deviceId(),
                device.getSignedPrekey(),
                device.getSignedPrekeyId(),
                device.getSignedPrekeySignature(),
                prekey == null ? null : prekey.getPublicKey(),
                prekey == null ? null : prekey.getKey().keyId());
    }

    /** Every key decodes to 32 bytes and the signed prekey verifies under the signing key. */
    static List<PrekeyRequest> validate(RegistrationRequest request) {
        KeyMaterial.requireId("device_id", request.deviceId());
        KeyMaterial.requireId("key_id", request.keyId());
        KeyMaterial.requireKey("identity_key", request.identityKey());
        byte[] signingKey = KeyMaterial.requireKey("signing_key", request.signingKey());
        RegistrationRequest.SignedPrekeyRequest signed = request.signedPrekey();
        if (signed == null) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "signed_prekey is required");
        }
        KeyMaterial.requireId("signed_prekey.key_id", signed.keyId());
        byte[] signedPrekey = KeyMaterial.requireKey("signed_prekey.public_key", signed.publicKey());
        byte[] signature = KeyMaterial.requireSignature("signed_prekey.signature", signed.signature());
        KeyMaterial.requireValidSignature(signingKey, signedPrekey, signature);
        List<PrekeyRequest> prekeys = request.oneTimePrekeys() == null ? List.of() : request.oneTimePrekeys();
        prekeys.forEach(prekey -> {
            KeyMaterial.requireId("one_time_prekeys.key_id", prekey.keyId());
            KeyMaterial.requireKey("one_time_prekeys.public_key", prekey.publicKey());
        });
        return prekeys;
    }
}
