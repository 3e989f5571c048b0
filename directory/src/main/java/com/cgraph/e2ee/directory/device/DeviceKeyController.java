package com.cgraph.e2ee.directory.device;

import com.cgraph.e2ee.directory.CallerHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/e2ee")
public class DeviceKeyController {

    private final DeviceKeyService deviceKeyService;

    public DeviceKeyController(DeviceKeyService deviceKeyService) {
        this.deviceKeyService = deviceKeyService;
    }

    @PostMapping("/keys")
    public Mono<RegistrationResponse> register(@RequestHeader(CallerHeaders.USER) String userId,
                                               @RequestBody RegistrationRequest request) {
        return deviceKeyService.register(userId, request);
    }

    /**
     * Prekey bundle lookup, used by senders before the first message of an exchange.
     * Returns ONLY public keys, and claims one of the recipient's one-time prekeys.
     */
    @GetMapping("/bundle/{userId}")
    public Mono<BundleResponse> bundle(@PathVariable String userId) {
        return deviceKeyService.bundle(userId);
    }

    /** Identity key lookup for safety numbers; consumes nothing. */
    @GetMapping("/keys/{userId}/identity")
    public Mono<IdentityKeyResponse> identityKey(@PathVariable String userId) {
        return deviceKeyService.identityKey(userId);
    }

    @GetMapping("/devices")
    public Flux<DeviceResponse> devices(@RequestHeader(CallerHeaders.USER) String userId) {
        return deviceKeyService.devices(userId);
    }

    @DeleteMapping("/keys/{deviceId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> revoke(@RequestHeader(CallerHeaders.USER) String userId,
                             @PathVariable String deviceId) {
        return deviceKeyService.revoke(userId, deviceId);
    }
}
