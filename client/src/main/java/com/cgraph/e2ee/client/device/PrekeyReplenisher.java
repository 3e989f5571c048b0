package com.cgraph.e2ee.client.device;

import com.cgraph.e2ee.client.directory.KeyDirectoryClient;
import com.cgraph.e2ee.client.keys.KeyBundleGenerator;
import com.cgraph.e2ee.client.store.OneTimePreKeyStore;
import com.cgraph.e2ee.client.wire.BundleFormatter;
import com.cgraph.e2ee.client.wire.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps this device's supply of one-time prekeys on the directory topped up.
 *
 * <p>Every check asks the directory how many keys remain. Below the low-water
 * mark it generates enough new keys to reach the high-water mark, stores their
 * private halves and uploads the public halves. Only one check runs at a time;
 * a check that starts while another is in flight completes without doing anything.
 *
 * <p>{@link #stop()} cancels the timer and every check still in flight, whether
 * the timer or {@link #onForeground()} started it, and no private half is stored
 * for a device once it has been stopped.
 */
public class PrekeyReplenisher {

    private static final Logger LOGGER = LoggerFactory.getLogger(PrekeyReplenisher.class);

    private final KeyDirectoryClient directory;
    private final KeyBundleGenerator generator;
    private final OneTimePreKeyStore oneTimePreKeys;
    private final int lowWaterMark;
    private final int highWaterMark;
    private final Duration interval;
    private final Scheduler scheduler;

    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicReference<Disposable> timer = new AtomicReference<>();
    private final AtomicReference<Disposable.Composite> foregroundChecks =
            new AtomicReference<>(Disposables.composite());
    private volatile String deviceId;

    public PrekeyReplenisher(KeyDirectoryClient directory,
                             KeyBundleGenerator generator,
                             OneTimePreKeyStore oneTimePreKeys,
                             int lowWaterMark,
                             int highWaterMark,
                             Duration interval,
                             Scheduler scheduler) {
        if (lowWaterMark > highWaterMark) {
            throw new IllegalArgumentException("low water mark must not exceed high water mark");
        }
        this.directory = directory;
        this.generator = generator;
        this.oneTimePreKeys = oneTimePreKeys;
        this.lowWaterMark = lowWaterMark;
        this.highWaterMark = highWaterMark;
        this.interval = interval;
        this.scheduler = scheduler;
    }

    /** Starts periodic checks for {@code deviceId}, replacing any running timer. */
    public void start(String deviceId) {
        this.deviceId = deviceId;
        Disposable ticks = Flux.interval(interval, interval, scheduler)
                .concatMap(tick -> checkAndReplenish()
                        .onErrorResume(e -> {
                            LOGGER.warn("Prekey replenishment failed, retrying next interval: {}", e.getMessage());
                            return Mono.empty();
                        }))
                .subscribe();
        Disposable previous = timer.getAndSet(ticks);
        if (previous != null) {
            previous.dispose();
        }
        LOGGER.info("Prekey replenishment started for device {} every {}", deviceId, interval);
    }

    public void stop() {
        String stopped = deviceId;
        deviceId = null;
        foregroundChecks.getAndSet(Disposables.composite()).dispose();
        Disposable previous = timer.getAndSet(null);
        if (previous != null) {
            previous.dispose();
            LOGGER.info("Prekey replenishment stopped for device {}", stopped);
        }
    }

    public boolean isRunning() {
        Disposable current = timer.get();
        return current != null && !current.isDisposed();
    }

    /** Check when the app comes back to the foreground; cancelled by {@link #stop()}. */
    public void onForeground() {
        if (deviceId == null) {
            return;
        }
        Disposable.Composite running = foregroundChecks.get();
        Disposable.Swap check = Disposables.swap();
        if (!running.add(check)) {
            return;
        }
        check.update(checkAndReplenish()
                .doFinally(signal -> running.remove(check))
                .subscribe(uploaded -> { },
                        e -> LOGGER.warn("Foreground prekey check failed: {}", e.getMessage())));
    }

    /**
     * Runs one check. Emits how many prekeys were uploaded, {@code 0} when the
     * supply was sufficient, another check was in flight, or no device is set.
     */
    public Mono<Integer> checkAndReplenish() {
        return Mono.defer(() -> {
            String device = deviceId;
            if (device == null || !inFlight.compareAndSet(false, true)) {
                return Mono.just(0);
            }
            return directory.remainingPreKeys(device)
                    .flatMap(remaining -> remaining.count() < lowWaterMark
                            ? topUp(device, (int) (highWaterMark - remaining.count()))
                            : Mono.just(0))
                    .defaultIfEmpty(0)
                    .doFinally(signal -> inFlight.set(false));
        });
    }

    /**
     * Stores the private halves, then uploads the public ones. A failed upload
     * takes the stored halves back out so the next check starts clean.
     */
    private Mono<Integer> topUp(String device, int needed) {
        LOGGER.info("Uploading {} one-time prekeys for device {}", needed, device);
        return generator.generateOneTimePreKeys(needed)
                .flatMap(prekeys -> {
                    if (!device.equals(deviceId)) {
                        LOGGER.info("Replenishment for device {} was stopped, discarding new prekeys", device);
                        return Mono.just(0);
                    }
                    return oneTimePreKeys.addAll(prekeys)
                            .then(Mono.defer(() -> directory.uploadPreKeys(device, BundleFormatter.formatForUpload(prekeys))))
                            .map(UploadResult::uploaded)
                            .onErrorResume(e -> oneTimePreKeys.removeAll(prekeys).then(Mono.error(e)));
                });
    }
}
