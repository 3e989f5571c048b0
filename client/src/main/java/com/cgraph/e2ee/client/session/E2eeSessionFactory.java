package com.cgraph.e2ee.client.session;

import com.cgraph.e2ee.client.agreement.X3dhAgreementEngine;
import com.cgraph.e2ee.client.device.ActiveDevice;
import com.cgraph.e2ee.client.device.DeviceLifecycleManager;
import com.cgraph.e2ee.client.device.PrekeyReplenisher;
import com.cgraph.e2ee.client.directory.KeyDirectoryClient;
import com.cgraph.e2ee.client.directory.PrekeyBundleCache;
import com.cgraph.e2ee.client.directory.WebClientKeyDirectoryClient;
import com.cgraph.e2ee.client.keys.KeyBundleGenerator;
import com.cgraph.e2ee.client.store.LocalKeyStore;
import com.cgraph.e2ee.client.store.NamespacedSecureStorage;
import com.cgraph.e2ee.client.store.OneTimePreKeyStore;
import com.cgraph.e2ee.client.store.SecureStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Wires an {@link E2eeSession} for a user. Each session gets its own bundle cache,
 * replenisher and storage namespace; nothing is shared between users but the
 * underlying {@link SecureStorage}.
 */
public class E2eeSessionFactory {

    private final E2eeClientProperties properties;
    private final SecureStorage storage;
    private final ObjectMapper mapper;
    private final WebClient.Builder webClientBuilder;
    private final KeyBundleGenerator generator;
    private final X3dhAgreementEngine agreement;
    private final Clock clock;
    private final Scheduler replenishScheduler;

    public E2eeSessionFactory(E2eeClientProperties properties,
                              SecureStorage storage,
                              ObjectMapper mapper,
                              WebClient.Builder webClientBuilder,
                              KeyBundleGenerator generator,
                              X3dhAgreementEngine agreement,
                              Clock clock) {
        this(properties, storage, mapper, webClientBuilder, generator, agreement, clock, Schedulers.parallel());
    }

    public E2eeSessionFactory(E2eeClientProperties properties,
                              SecureStorage storage,
                              ObjectMapper mapper,
                              WebClient.Builder webClientBuilder,
                              KeyBundleGenerator generator,
                              X3dhAgreementEngine agreement,
                              Clock clock,
                              Scheduler replenishScheduler) {
        this.properties = properties;
        this.storage = storage;
        this.mapper = mapper;
        this.webClientBuilder = webClientBuilder;
        this.generator = generator;
        this.agreement = agreement;
        this.clock = clock;
        this.replenishScheduler = replenishScheduler;
    }

    /** A session talking to the configured directory as {@code userId}. */
    public E2eeSession open(String userId) {
        return open(userId, new WebClientKeyDirectoryClient(webClientBuilder, properties.directoryBaseUrl(), userId,
                properties.directoryRetryAttempts(), properties.directoryRetryBackoff()));
    }

    public E2eeSession open(String userId, KeyDirectoryClient directory) {
        SecureStorage userStorage = new NamespacedSecureStorage(storage, userId);
        LocalKeyStore keyStore = new LocalKeyStore(userStorage, mapper, new OneTimePreKeyStore(userStorage, mapper,
                clock, properties.oneTimePrekeyRetention(), properties.oneTimePrekeyCapacity()));
        PrekeyBundleCache bundleCache = new PrekeyBundleCache(directory, clock, properties.bundleCacheTtl());
        PrekeyReplenisher replenisher = new PrekeyReplenisher(directory, generator, keyStore.oneTimePreKeys(),
                properties.lowWaterMark(), properties.highWaterMark(), properties.replenishInterval(),
                replenishScheduler);
        ActiveDevice activeDevice = new ActiveDevice();
        DeviceLifecycleManager devices = new DeviceLifecycleManager(directory, keyStore, replenisher,
                bundleCache, activeDevice);
        return new E2eeSession(userId, properties.oneTimePrekeyBatch(), generator, keyStore, directory,
                bundleCache, agreement, replenisher, devices, activeDevice);
    }
}
