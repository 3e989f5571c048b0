package com.cgraph.e2ee.directory.prekey;

import com.cgraph.e2ee.directory.CallerHeaders;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/e2ee/prekeys")
public class PrekeyController {

    private final PrekeyService prekeyService;

    public PrekeyController(PrekeyService prekeyService) {
        this.prekeyService = prekeyService;
    }

    @PostMapping
    public Mono<UploadResponse> upload(@RequestHeader(CallerHeaders.USER) String userId,
                                       @RequestHeader(CallerHeaders.DEVICE) String deviceId,
                                       @RequestBody PrekeyUploadRequest request) {
        return prekeyService.upload(userId, deviceId, request);
    }

    /** How many one-time prekeys the calling device has left. */
    @GetMapping("/count")
    public Mono<PrekeyCountResponse> count(@RequestHeader(CallerHeaders.USER) String userId,
                                           @RequestHeader(CallerHeaders.DEVICE) String deviceId) {
        return prekeyService.count(userId, deviceId);
    }
}
