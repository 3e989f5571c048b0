package com.cgraph.e2ee.client.directory;

import com.cgraph.e2ee.client.wire.DeviceInfo;
import com.cgraph.e2ee.client.wire.IdentityKeyRecord;
import com.cgraph.e2ee.client.wire.PreKeyUpload;
import com.cgraph.e2ee.client.wire.PrekeyCount;
import com.cgraph.e2ee.client.wire.RegistrationPayload;
import com.cgraph.e2ee.client.wire.RegistrationResult;
import com.cgraph.e2ee.client.wire.ServerPrekeyBundle;
import com.cgraph.e2ee.client.wire.UploadResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The key directory as seen by one logged-in user.
 *
 * <p>Failures are signalled as {@link com.cgraph.e2ee.client.error.DirectoryException}.
 * Bundles are validated before they are emitted.
 */
public interface KeyDirectoryClient {

    Mono<RegistrationResult> register(RegistrationPayload payload);

    Mono<UploadResult> uploadPreKeys(String deviceId, PreKeyUpload upload);

    Mono<PrekeyCount> remainingPreKeys(String deviceId);

    /** Fetches a bundle; the directory hands out and consumes one one-time prekey per call. */
    Mono<ServerPrekeyBundle> fetchBundle(String userId);

    Mono<IdentityKeyRecord> fetchIdentityKey(String userId);

    Flux<DeviceInfo> listDevices();

    Mono<Void> revokeDevice(String deviceId);
}
