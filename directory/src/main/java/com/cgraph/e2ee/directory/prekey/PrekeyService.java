package com.cgraph.e2ee.directory.prekey;

import com.cgraph.e2ee.directory.DirectoryProperties;
import com.cgraph.e2ee.directory.KeyMaterial;
import com.cgraph.e2ee.directory.device.DeviceKeysKey;
import com.cgraph.e2ee.directory.device.DeviceKeysRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.cassandra.core.DeleteOptions;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.WriteResult;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * One-time prekey bookkeeping for every registered device.
 *
 * <p><strong>Single issue:</strong> {@link #consumeOne} deletes the row with a
 * lightweight transaction ({@code DELETE ... IF EXISTS}). Two concurrent bundle
 * requests may read the same candidate, but only one delete is applied; the
 * loser moves on to the next key.
 */
@Service
public class PrekeyService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PrekeyService.class);

    private static final DeleteOptions IF_EXISTS = DeleteOptions.builder().withIfExists().build();

    private final OneTimePrekeyRepository repository;
    private final DeviceKeysRepository devices;
    private final ReactiveCassandraOperations operations;
    private final DirectoryProperties properties;
    private final Clock clock;

    public PrekeyService(OneTimePrekeyRepository repository,
                         DeviceKeysRepository devices,
                         ReactiveCassandraOperations operations,
                         DirectoryProperties properties,
                         Clock clock) {
        this.repository = repository;
        this.devices = devices;
        this.operations = operations;
        this.properties = properties;
        this.clock = clock;
    }

    /** Adds prekeys to a registered device. */
    public Mono<UploadResponse> upload(String userId, String deviceId, PrekeyUploadRequest request) {
        return Mono.defer(() -> {
            List<PrekeyRequest> prekeys = validate(request.prekeys());
            return requireDevice(userId, deviceId)
                    .then(Mono.defer(() -> save(userId, deviceId, prekeys)))
                    .then(Mono.defer(() -> repository.countByKeyUserIdAndKeyDeviceId(userId, deviceId)))
                    .map(total -> {
                        LOGGER.info("Device {} of {} uploaded {} one-time prekeys, {} available",
                                deviceId, userId, prekeys.size(), total);
                        return new UploadResponse(prekeys.size(), total);
                    });
        });
    }

    public Mono<PrekeyCountResponse> count(String userId, String deviceId) {
        return repository.countByKeyUserIdAndKeyDeviceId(userId, deviceId)
                .defaultIfEmpty(0L)
                .map(count -> new PrekeyCountResponse(count, count < properties.lowPrekeyThreshold()));
    }

    /**
     * Drops whatever the device had published and stores {@code prekeys} instead.
     * Used on (re-)registration.
     */
    public Mono<Integer> replaceAll(String userId, String deviceId, List<PrekeyRequest> prekeys) {
        return deleteAll(userId, deviceId)
                .then(Mono.defer(() -> save(userId, deviceId, prekeys)))
                .thenReturn(prekeys.size());
    }

    /**
     * Claims one of the device's prekeys for a sender. Completes empty when the
     * device has none left.
     */
    public Mono<OneTimePrekeyEntity> consumeOne(String userId, String deviceId) {
        return repository.findAllByKeyUserIdAndKeyDeviceId(userId, deviceId)
                .concatMap(candidate -> operations.delete(candidate, IF_EXISTS)
                        .filter(WriteResult::wasApplied)
                        .map(applied -> candidate))
                .next()
                .doOnNext(claimed -> LOGGER.debug("Issued one-time prekey {} of device {}",
                        claimed.getKey().keyId(), deviceId));
    }

    public Mono<Void> deleteAll(String userId, String deviceId) {
        return repository.deleteAll(repository.findAllByKeyUserIdAndKeyDeviceId(userId, deviceId));
    }

    /** Checks every prekey; any malformed entry rejects the whole batch. */
    static List<PrekeyRequest> validate(List<PrekeyRequest> prekeys) {
        if (prekeys == null) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "prekeys is required");
        }
        for (PrekeyRequest prekey : prekeys) {
            KeyMaterial.requireId("key_id", prekey.keyId());
            KeyMaterial.requireKey("public_key", prekey.publicKey());
        }
        return prekeys;
    }

    private Mono<Void> requireDevice(String userId, String deviceId) {
        return devices.existsById(new DeviceKeysKey(userId, deviceId))
                .flatMap(exists -> exists
                        ? Mono.<Void>empty()
                        : Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                                "Device not registered: " + deviceId)));
    }

    private Mono<Void> save(String userId, String deviceId, List<PrekeyRequest> prekeys) {
        return Flux.fromIterable(prekeys)
                .map(prekey -> new OneTimePrekeyEntity(new OneTimePrekeyKey(userId, deviceId, prekey.keyId()),
                        prekey.publicKey(), clock.instant()))
                .collectList()
                .flatMapMany(entities -> repository.saveAll(entities))
                .then();
    }
}
