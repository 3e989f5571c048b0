package com.cgraph.e2ee.client.device;

import com.cgraph.e2ee.client.directory.KeyDirectoryClient;
import com.cgraph.e2ee.client.error.DirectoryException;
import com.cgraph.e2ee.client.keys.KeyBundleGenerator;
import com.cgraph.e2ee.client.store.InMemorySecureStorage;
import com.cgraph.e2ee.client.store.OneTimePreKeyStore;
import com.cgraph.e2ee.client.wire.PreKeyUpload;
import com.cgraph.e2ee.client.wire.PrekeyCount;
import com.cgraph.e2ee.client.wire.UploadResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrekeyReplenisherTest {

    private static final String DEVICE = "jvm_device";

    @Mock
    private KeyDirectoryClient directory;

    private VirtualTimeScheduler scheduler;
    private OneTimePreKeyStore store;
    private PrekeyReplenisher replenisher;

    @BeforeEach
    void setup() {
        scheduler = VirtualTimeScheduler.create();
        store = new OneTimePreKeyStore(new InMemorySecureStorage(), new ObjectMapper());
        replenisher = new PrekeyReplenisher(directory, new KeyBundleGenerator(), store,
                20, 100, Duration.ofMinutes(5), scheduler);
    }

    @AfterEach
    void teardown() {
        replenisher.stop();
        scheduler.dispose();
    }

    @Test
    void topsUpToHighWaterMarkBelowLowWaterMark() {
        replenisher.start(DEVICE);
        when(directory.remainingPreKeys(DEVICE)).thenReturn(Mono.just(new PrekeyCount(10, true)));
        when(directory.uploadPreKeys(eq(DEVICE), any())).thenReturn(Mono.just(new UploadResult(90, 100)));

        StepVerifier.create(replenisher.checkAndReplenish())
                .expectNext(90)
                .verifyComplete();

        ArgumentCaptor<PreKeyUpload> upload = ArgumentCaptor.forClass(PreKeyUpload.class);
        verify(directory).uploadPreKeys(eq(DEVICE), upload.capture());
        assertEquals(90, upload.getValue().prekeys().size());
        assertEquals(90, store.size().block(), "private halves must be kept for every uploaded key");
    }

    @Test
    void leavesSufficientSupplyAlone() {
        replenisher.start(DEVICE);
        when(directory.remainingPreKeys(DEVICE)).thenReturn(Mono.just(new PrekeyCount(20, true)));

        StepVerifier.create(replenisher.checkAndReplenish())
                .expectNext(0)
                .verifyComplete();

        verify(directory, never()).uploadPreKeys(any(), any());
    }

    @Test
    void overlappingChecksProduceExactlyOneTopUp() {
        replenisher.start(DEVICE);
        Sinks.One<PrekeyCount> pending = Sinks.one();
        when(directory.remainingPreKeys(DEVICE)).thenReturn(pending.asMono());
        when(directory.uploadPreKeys(eq(DEVICE), any())).thenReturn(Mono.just(new UploadResult(95, 100)));

        StepVerifier.create(replenisher.checkAndReplenish())
                .then(() -> {
                    StepVerifier.create(replenisher.checkAndReplenish())
                            .expectNext(0)
                            .verifyComplete();
                    pending.tryEmitValue(new PrekeyCount(5, true));
                })
                .expectNext(95)
                .verifyComplete();

        verify(directory, times(1)).remainingPreKeys(DEVICE);
        verify(directory, times(1)).uploadPreKeys(eq(DEVICE), any());
    }

    @Test
    void timerChecksEveryIntervalUntilStopped() {
        when(directory.remainingPreKeys(DEVICE)).thenReturn(Mono.just(new PrekeyCount(100, false)));
        replenisher.start(DEVICE);

        scheduler.advanceTimeBy(Duration.ofMinutes(4));
        verify(directory, never()).remainingPreKeys(DEVICE);

        scheduler.advanceTimeBy(Duration.ofMinutes(1));
        verify(directory, times(1)).remainingPreKeys(DEVICE);

        replenisher.stop();
        assertFalse(replenisher.isRunning());
        scheduler.advanceTimeBy(Duration.ofMinutes(30));
        verify(directory, times(1)).remainingPreKeys(DEVICE);
    }

    @Test
    void failedTickDoesNotStopTheTimer() {
        when(directory.remainingPreKeys(DEVICE))
                .thenReturn(Mono.error(new DirectoryException("down", null, 0, true)))
                .thenReturn(Mono.just(new PrekeyCount(100, false)));
        replenisher.start(DEVICE);

        scheduler.advanceTimeBy(Duration.ofMinutes(10));

        verify(directory, times(2)).remainingPreKeys(DEVICE);
        assertTrue(replenisher.isRunning());
    }

    @Test
    void stopCancelsForegroundCheckWaitingOnTheDirectory() {
        replenisher.start(DEVICE);
        Sinks.One<PrekeyCount> pending = Sinks.one();
        when(directory.remainingPreKeys(DEVICE)).thenReturn(pending.asMono());

        replenisher.onForeground();
        assertEquals(1, pending.currentSubscriberCount());

        replenisher.stop();
        assertEquals(0, pending.currentSubscriberCount(), "a stopped device must not keep a check in flight");

        pending.tryEmitValue(new PrekeyCount(5, true));
        verify(directory, never()).uploadPreKeys(any(), any());
        assertEquals(0, store.size().block());
    }

    @Test
    void checkAnsweredAfterStopStoresNothing() {
        replenisher.start(DEVICE);
        Sinks.One<PrekeyCount> pending = Sinks.one();
        when(directory.remainingPreKeys(DEVICE)).thenReturn(pending.asMono());

        StepVerifier.create(replenisher.checkAndReplenish())
                .then(() -> {
                    replenisher.stop();
                    pending.tryEmitValue(new PrekeyCount(5, true));
                })
                .expectNext(0)
                .verifyComplete();

        verify(directory, never()).uploadPreKeys(any(), any());
        assertEquals(0, store.size().block());
    }

    @Test
    void failedUploadTakesBackStoredHalves() {
        replenisher.start(DEVICE);
        when(directory.remainingPreKeys(DEVICE)).thenReturn(Mono.just(new PrekeyCount(10, true)));
        when(directory.uploadPreKeys(eq(DEVICE), any()))
                .thenReturn(Mono.error(new DirectoryException("unavailable", null, 503, true)));

        StepVerifier.create(replenisher.checkAndReplenish())
                .expectError(DirectoryException.class)
                .verify();

        assertEquals(0, store.size().block());
    }

    @Test
    void doesNothingWithoutADevice() {
        StepVerifier.create(replenisher.checkAndReplenish())
                .expectNext(0)
                .verifyComplete();

        verify(directory, never()).remainingPreKeys(any());
    }
}
