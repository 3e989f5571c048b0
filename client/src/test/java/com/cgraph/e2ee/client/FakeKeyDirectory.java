package com.cgraph.e2ee.client;

import com.cgraph.e2ee.client.directory.KeyDirectoryClient;
import com.cgraph.e2ee.client.error.DirectoryException;
import com.cgraph.e2ee.client.wire.DeviceInfo;
import com.cgraph.e2ee.client.wire.IdentityKeyRecord;
import com.cgraph.e2ee.client.wire.PreKeyPayload;
import com.cgraph.e2ee.client.wire.PreKeyUpload;
import com.cgraph.e2ee.client.wire.PrekeyCount;
import com.cgraph.e2ee.client.wire.RegistrationPayload;
import com.cgraph.e2ee.client.wire.RegistrationResult;
import com.cgraph.e2ee.client.wire.ServerPrekeyBundle;
import com.cgraph.e2ee.client.wire.UploadResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory key directory with the server's rules: newest device wins, each
 * one-time prekey is handed out once, unknown users are a 404.
 */
public class FakeKeyDirectory {

    private final Map<String, LinkedHashMap<String, Device>> users = new LinkedHashMap<>();
    private final List<String> issuedPrekeyIds = new ArrayList<>();
    private final AtomicBoolean offline = new AtomicBoolean();
    private final AtomicInteger calls = new AtomicInteger();

    public KeyDirectoryClient clientFor(String userId) {
        return new Client(userId);
    }

    public void setOffline(boolean value) {
        offline.set(value);
    }

    public int calls() {
        return calls.get();
    }

    public synchronized int remainingPrekeys(String userId) {
        Device device = newest(userId);
        return device == null ? 0 : device.prekeys.size();
    }

    public synchronized List<String> issuedPrekeyIds() {
        return List.copyOf(issuedPrekeyIds);
    }

    public synchronized boolean hasDevice(String userId, String deviceId) {
        return users.containsKey(userId) && users.get(userId).containsKey(deviceId);
    }

    private Device newest(String userId) {
        LinkedHashMap<String, Device> devices = users.get(userId);
        if (devices == null || devices.isEmpty()) {
            return null;
        }
        Device last = null;
        for (Device device : devices.values()) {
            last = device;
        }
        return last;
    }

    private <T> Mono<T> guarded(Supplier<T> action) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            if (offline.get()) {
                return Mono.error(new DirectoryException("Directory unreachable", null, 0, true));
            }
            synchronized (this) {
                return Mono.justOrEmpty(action.get());
            }
        });
    }

    private static DirectoryException notFound(String what) {
        return new DirectoryException(what + " not found", null, 404, false);
    }

    private static final class Device {
        final RegistrationPayload registration;
        final Deque<PreKeyPayload> prekeys;
        final Instant createdAt = Instant.now();

        Device(RegistrationPayload registration) {
            this.registration = registration;
            this.prekeys = new ArrayDeque<>(registration.oneTimePrekeys());
        }
    }

    private final class Client implements KeyDirectoryClient {

        private final String userId;

        Client(String userId) {
            this.userId = userId;
        }

        @Override
        public Mono<RegistrationResult> register(RegistrationPayload payload) {
            return guarded(() -> {
                users.computeIfAbsent(userId, id -> new LinkedHashMap<>())
                        .put(payload.deviceId(), new Device(payload));
                return new RegistrationResult(payload.keyId(), payload.signedPrekey().keyId(),
                        payload.oneTimePrekeys().size());
            });
        }

        @Override
        public Mono<UploadResult> uploadPreKeys(String deviceId, PreKeyUpload upload) {
            return guarded(() -> {
                Device device = users.getOrDefault(userId, new LinkedHashMap<>()).get(deviceId);
                if (device == null) {
                    throw notFound("Device " + deviceId);
                }
                device.prekeys.addAll(upload.prekeys());
                return new UploadResult(upload.prekeys().size(), device.prekeys.size());
            });
        }

        @Override
        public Mono<PrekeyCount> remainingPreKeys(String deviceId) {
            return guarded(() -> {
                Device device = users.getOrDefault(userId, new LinkedHashMap<>()).get(deviceId);
                int count = device == null ? 0 : device.prekeys.size();
                return new PrekeyCount(count, count < 25);
            });
        }

        @Override
        public Mono<ServerPrekeyBundle> fetchBundle(String recipientId) {
            return guarded(() -> {
                Device device = newest(recipientId);
                if (device == null) {
                    throw notFound("User " + recipientId);
                }
                RegistrationPayload reg = device.registration;
                PreKeyPayload prekey = device.prekeys.pollFirst();
                if (prekey != null) {
                    issuedPrekeyIds.add(prekey.keyId());
                }
                return new ServerPrekeyBundle(reg.identityKey(), reg.keyId(), reg.signingKey(), reg.deviceId(),
                        reg.signedPrekey().publicKey(), reg.signedPrekey().keyId(), reg.signedPrekey().signature(),
                        prekey == null ? null : prekey.publicKey(),
                        prekey == null ? null : prekey.keyId()).validate();
            });
        }

        @Override
        public Mono<IdentityKeyRecord> fetchIdentityKey(String otherUserId) {
            return guarded(() -> {
                Device device = newest(otherUserId);
                if (device == null) {
                    throw notFound("User " + otherUserId);
                }
                return new IdentityKeyRecord(otherUserId, device.registration.deviceId(),
                        device.registration.identityKey(), device.registration.keyId());
            });
        }

        @Override
        public Flux<DeviceInfo> listDevices() {
            return guarded(() -> users.getOrDefault(userId, new LinkedHashMap<>()).entrySet().stream()
                    .map(entry -> new DeviceInfo(entry.getKey(), entry.getValue().createdAt))
                    .toList())
                    .flatMapMany(Flux::fromIterable);
        }

        @Override
        public Mono<Void> revokeDevice(String deviceId) {
            return guarded(() -> {
                LinkedHashMap<String, Device> devices = users.get(userId);
                if (devices == null || devices.remove(deviceId) == null) {
                    throw notFound("Device " + deviceId);
                }
                return null;
            }).then();
        }
    }
}
