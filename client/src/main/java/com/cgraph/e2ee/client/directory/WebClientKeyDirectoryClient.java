package com.cgraph.e2ee.client.directory;

import com.cgraph.e2ee.client.error.DirectoryException;
import com.cgraph.e2ee.client.wire.DeviceInfo;
import com.cgraph.e2ee.client.wire.IdentityKeyRecord;
import com.cgraph.e2ee.client.wire.PreKeyUpload;
import com.cgraph.e2ee.client.wire.PrekeyCount;
import com.cgraph.e2ee.client.wire.RegistrationPayload;
import com.cgraph.e2ee.client.wire.RegistrationResult;
import com.cgraph.e2ee.client.wire.ServerPrekeyBundle;
import com.cgraph.e2ee.client.wire.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;

/**
 * {@link KeyDirectoryClient} over the directory's HTTP API.
 *
 * <p>Network errors and 5xx answers are retried with exponential backoff; 4xx
 * answers fail at once. When retries run out the last failure is signalled
 * as-is.
 */
public class WebClientKeyDirectoryClient implements KeyDirectoryClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebClientKeyDirectoryClient.class);

    private static final String BASE_PATH = "/api/v1/e2ee";

    private final WebClient webClient;
    private final RetryBackoffSpec retry;

    public WebClientKeyDirectoryClient(WebClient.Builder builder, String baseUrl, String userId,
                                       int retryAttempts, Duration retryBackoff) {
        this.webClient = builder.clone()
                .baseUrl(baseUrl + BASE_PATH)
                .defaultHeader(DirectoryHeaders.AUTHENTICATED_USER, userId)
                .build();
        this.retry = Retry.backoff(retryAttempts, retryBackoff)
                .filter(WebClientKeyDirectoryClient::isRetryable)
                .doBeforeRetry(signal -> LOGGER.debug("Retrying directory call, attempt {}",
                        signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    @Override
    public Mono<RegistrationResult> register(RegistrationPayload payload) {
        return call("register device", webClient.post()
                .uri("/keys")
                .header(DirectoryHeaders.DEVICE_ID, payload.deviceId())
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(RegistrationResult.class));
    }

    @Override
    public Mono<UploadResult> uploadPreKeys(String deviceId, PreKeyUpload upload) {
        return call("upload prekeys", webClient.post()
                .uri("/prekeys")
                .header(DirectoryHeaders.DEVICE_ID, deviceId)
                .bodyValue(upload)
                .retrieve()
                .bodyToMono(UploadResult.class));
    }

    @Override
    public Mono<PrekeyCount> remainingPreKeys(String deviceId) {
        return call("count prekeys", webClient.get()
                .uri("/prekeys/count")
                .header(DirectoryHeaders.DEVICE_ID, deviceId)
                .retrieve()
                .bodyToMono(PrekeyCount.class));
    }

    @Override
    public Mono<ServerPrekeyBundle> fetchBundle(String userId) {
        // Validation runs after the retry: a malformed bundle is not a transport problem.
        return call("fetch bundle", webClient.get()
                .uri("/bundle/{userId}", userId)
                .retrieve()
                .bodyToMono(ServerPrekeyBundle.class))
                .map(ServerPrekeyBundle::validate);
    }

    @Override
    public Mono<IdentityKeyRecord> fetchIdentityKey(String userId) {
        return call("fetch identity key", webClient.get()
                .uri("/keys/{userId}/identity", userId)
                .retrieve()
                .bodyToMono(IdentityKeyRecord.class));
    }

    @Override
    public Flux<DeviceInfo> listDevices() {
        return webClient.get()
                .uri("/devices")
                .retrieve()
                .bodyToFlux(DeviceInfo.class)
                .onErrorMap(e -> toDirectoryException("list devices", e))
                .retryWhen(retry);
    }

    @Override
    public Mono<Void> revokeDevice(String deviceId) {
        return call("revoke device", webClient.delete()
                .uri("/keys/{deviceId}", deviceId)
                .retrieve()
                .bodyToMono(Void.class));
    }

    private <T> Mono<T> call(String operation, Mono<T> request) {
        return request
                .onErrorMap(e -> toDirectoryException(operation, e))
                .retryWhen(retry);
    }

    private static Throwable toDirectoryException(String operation, Throwable error) {
        if (error instanceof DirectoryException) {
            return error;
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return new DirectoryException("Directory refused to " + operation + ": HTTP " + status,
                    error, status, response.getStatusCode().is5xxServerError());
        }
        if (error instanceof WebClientRequestException) {
            return new DirectoryException("Directory unreachable, could not " + operation, error, 0, true);
        }
        return error;
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof DirectoryException directory && directory.isRetryable();
    }
}
