package com.cgraph.e2ee.directory.device;

import com.cgraph.e2ee.directory.TestKeys;
import com.cgraph.e2ee.directory.prekey.OneTimePrekeyEntity;
import com.cgraph.e2ee.directory.prekey.OneTimePrekeyKey;
import com.cgraph.e2ee.directory.prekey.PrekeyRequest;
import com.cgraph.e2ee.directory.prekey.PrekeyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DeviceKeyService.
 *
 * Repositories and the prekey service are mocked, so no Cassandra is needed.
 */
@ExtendWith(MockitoExtension.class)
class DeviceKeyServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private DeviceKeysRepository repository;

    @Mock
    private PrekeyService prekeyService;

    private DeviceKeyService service;

    @BeforeEach
    void setup() {
        service = new DeviceKeyService(repository, prekeyService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static DeviceKeysEntity device(String userId, String deviceId, String identityKey, Instant createdAt) {
        DeviceKeysEntity entity = new DeviceKeysEntity();
        entity.setKey(new DeviceKeysKey(userId, deviceId));
        entity.setIdentityKey(identityKey);
        entity.setIdentityKeyId("ik-" + deviceId);
        entity.setSigningKey("signing-" + deviceId);
        entity.setSignedPrekey("spk-" + deviceId);
        entity.setSignedPrekeyId("spk-id-" + deviceId);
        entity.setSignedPrekeySignature("sig-" + deviceId);
        entity.setCreatedAt(createdAt);
        return entity;
    }

    private static void assertStatus(Throwable error, HttpStatus status) {
        ResponseStatusException rse = assertInstanceOf(ResponseStatusException.class, error);
        assertEquals(status, rse.getStatusCode());
    }

    // ── register ──────────────────────────────────────────────────────────────

    @Test
    void registersNewDeviceWithItsPrekeys() {
        RegistrationRequest request = TestKeys.registration("jvm_1", 3);
        when(repository.findById(new DeviceKeysKey("bob", "jvm_1"))).thenReturn(Mono.empty());
        when(repository.save(any(DeviceKeysEntity.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(prekeyService.replaceAll(eq("bob"), eq("jvm_1"), anyList())).thenReturn(Mono.just(3));

        StepVerifier.create(service.register("bob", request))
                .assertNext(response -> {
                    assertEquals("ik-jvm_1", response.identityKeyId());
                    assertEquals("spk-jvm_1", response.signedPrekeyId());
                    assertEquals(3, response.oneTimePrekeyCount());
                })
                .verifyComplete();

        ArgumentCaptor<DeviceKeysEntity> saved = ArgumentCaptor.forClass(DeviceKeysEntity.class);
        verify(repository).save(saved.capture());
        assertEquals(NOW, saved.getValue().getCreatedAt());
        assertEquals(request.identityKey(), saved.getValue().getIdentityKey());
        assertFalse(saved.getValue().isVerified());
    }

    @Test
    void identityKeyChangeResetsVerifiedFlag() {
        DeviceKeysEntity existing = device("bob", "jvm_1", TestKeys.publicKey(), NOW.minusSeconds(3600));
        existing.setVerified(true);
        RegistrationRequest request = TestKeys.registration("jvm_1", 1);
        when(repository.findById(new DeviceKeysKey("bob", "jvm_1"))).thenReturn(Mono.just(existing));
        when(repository.save(any(DeviceKeysEntity.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(prekeyService.replaceAll(eq("bob"), eq("jvm_1"), anyList())).thenReturn(Mono.just(1));

        service.register("bob", request).block();

        ArgumentCaptor<DeviceKeysEntity> saved = ArgumentCaptor.forClass(DeviceKeysEntity.class);
        verify(repository).save(saved.capture());
        assertFalse(saved.getValue().isVerified());
        assertEquals(request.identityKey(), saved.getValue().getIdentityKey());
        assertEquals(NOW.minusSeconds(3600), saved.getValue().getCreatedAt(), "creation time is kept");
    }

    @Test
    void sameIdentityKeyKeepsVerifiedFlag() {
        String identityKey = TestKeys.publicKey();
        DeviceKeysEntity existing = device("bob", "jvm_1", identityKey, NOW.minusSeconds(60));
        existing.setVerified(true);
        when(repository.findById(new DeviceKeysKey("bob", "jvm_1"))).thenReturn(Mono.just(existing));
        when(repository.save(any(DeviceKeysEntity.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(prekeyService.replaceAll(eq("bob"), eq("jvm_1"), anyList())).thenReturn(Mono.just(2));

        service.register("bob", TestKeys.registration("jvm_1", identityKey, 2)).block();

        ArgumentCaptor<DeviceKeysEntity> saved = ArgumentCaptor.forClass(DeviceKeysEntity.class);
        verify(repository).save(saved.capture());
        assertTrue(saved.getValue().isVerified());
    }

    @Test
    void forgedSignatureIsUnprocessable() {
        RegistrationRequest genuine = TestKeys.registration("jvm_1", 1);
        RegistrationRequest forged = new RegistrationRequest(genuine.identityKey(), genuine.keyId(),
                genuine.deviceId(), genuine.signingKey(),
                new RegistrationRequest.SignedPrekeyRequest(TestKeys.publicKey(),
                        genuine.signedPrekey().signature(), genuine.signedPrekey().keyId()),
                genuine.oneTimePrekeys());

        StepVerifier.create(service.register("bob", forged))
                .expectErrorSatisfies(e -> assertStatus(e, HttpStatus.UNPROCESSABLE_ENTITY))
                .verify();

        verify(repository, never()).save(any());
    }

    @Test
    void shortKeyIsUnprocessable() {
        RegistrationRequest genuine = TestKeys.registration("jvm_1", 1);
        RegistrationRequest truncated = new RegistrationRequest(
                Base64.getEncoder().encodeToString(new byte[31]), genuine.keyId(), genuine.deviceId(),
                genuine.signingKey(), genuine.signedPrekey(), genuine.oneTimePrekeys());

        StepVerifier.create(service.register("bob", truncated))
                .expectErrorSatisfies(e -> assertStatus(e, HttpStatus.UNPROCESSABLE_ENTITY))
                .verify();
    }

    @Test
    void nonBase64PrekeyIsUnprocessable() {
        RegistrationRequest genuine = TestKeys.registration("jvm_1", 0);
        RegistrationRequest broken = new RegistrationRequest(genuine.identityKey(), genuine.keyId(),
                genuine.deviceId(), genuine.signingKey(), genuine.signedPrekey(),
                List.of(new PrekeyRequest("otp-1", "not base64!")));

        StepVerifier.create(service.register("bob", broken))
                .expectErrorSatisfies(e -> assertStatus(e, HttpStatus.UNPROCESSABLE_ENTITY))
                .verify();
    }

    // ── bundle / identity ─────────────────────────────────────────────────────

    @Test
    void bundleComesFromNewestDeviceWithOneTimePrekey() {
        DeviceKeysEntity old = device("bob", "jvm_old", "ik-old", NOW.minusSeconds(7200));
        DeviceKeysEntity newest = device("bob", "jvm_new", "ik-new", NOW.minusSeconds(60));
        when(repository.findAllByKeyUserId("bob")).thenReturn(Flux.just(newest, old));
        when(prekeyService.consumeOne("bob", "jvm_new")).thenReturn(Mono.just(
                new OneTimePrekeyEntity(new OneTimePrekeyKey("bob", "jvm_new", "otp-7"), "otp-public", NOW)));

        StepVerifier.create(service.bundle("bob"))
                .assertNext(bundle -> {
                    assertEquals("jvm_new", bundle.deviceId());
                    assertEquals("ik-new", bundle.identityKey());
                    assertEquals("otp-7", bundle.oneTimePrekeyId());
                    assertEquals("otp-public", bundle.oneTimePrekey());
                })
                .verifyComplete();
    }

    @Test
    void bundleWithoutPrekeysLeft() {
        when(repository.findAllByKeyUserId("bob"))
                .thenReturn(Flux.just(device("bob", "jvm_1", "ik", NOW)));
        when(prekeyService.consumeOne("bob", "jvm_1")).thenReturn(Mono.empty());

        StepVerifier.create(service.bundle("bob"))
                .assertNext(bundle -> {
                    assertNull(bundle.oneTimePrekey());
                    assertNull(bundle.oneTimePrekeyId());
                })
                .verifyComplete();
    }

    @Test
    void unknownUserIsNotFound() {
        when(repository.findAllByKeyUserId("nobody")).thenReturn(Flux.empty());

        StepVerifier.create(service.bundle("nobody"))
                .expectErrorSatisfies(e -> assertStatus(e, HttpStatus.NOT_FOUND))
                .verify();
    }

    @Test
    void identityLookupConsumesNoPrekey() {
        when(repository.findAllByKeyUserId("bob"))
                .thenReturn(Flux.just(device("bob", "jvm_1", "ik-bob", NOW)));

        StepVerifier.create(service.identityKey("bob"))
                .assertNext(identity -> {
                    assertEquals("bob", identity.userId());
                    assertEquals("ik-bob", identity.identityKey());
                })
                .verifyComplete();

        verify(prekeyService, never()).consumeOne(anyString(), anyString());
    }

    // ── devices / revoke ──────────────────────────────────────────────────────

    @Test
    void devicesAreListedOldestFirst() {
        when(repository.findAllByKeyUserId("bob")).thenReturn(Flux.just(
                device("bob", "jvm_b", "ik", NOW),
                device("bob", "jvm_a", "ik", NOW.minusSeconds(10))));

        StepVerifier.create(service.devices("bob"))
                .assertNext(d -> assertEquals("jvm_a", d.deviceId()))
                .assertNext(d -> assertEquals("jvm_b", d.deviceId()))
                .verifyComplete();
    }

    @Test
    void revokeDeletesKeysAndPrekeys() {
        DeviceKeysEntity device = device("bob", "jvm_1", "ik", NOW);
        when(repository.findById(new DeviceKeysKey("bob", "jvm_1"))).thenReturn(Mono.just(device));
        when(repository.delete(device)).thenReturn(Mono.empty());
        when(prekeyService.deleteAll("bob", "jvm_1")).thenReturn(Mono.empty());

        StepVerifier.create(service.revoke("bob", "jvm_1")).verifyComplete();

        verify(repository).delete(device);
        verify(prekeyService).deleteAll("bob", "jvm_1");
    }

    @Test
    void revokeUnknownDeviceIsNotFound() {
        when(repository.findById(new DeviceKeysKey("bob", "jvm_gone"))).thenReturn(Mono.empty());

        StepVerifier.create(service.revoke("bob", "jvm_gone"))
                .expectErrorSatisfies(e -> assertStatus(e, HttpStatus.NOT_FOUND))
                .verify();

        verify(prekeyService, never()).deleteAll(anyString(), anyString());
    }
}
