package com.cgraph.e2ee.client.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Client settings, bound from {@code cgraph.e2ee.*}.
 *
 * @param oneTimePrekeyBatch one-time prekeys generated at setup
 * @param lowWaterMark       remaining count below which replenishment uploads
 * @param highWaterMark      count replenishment tops up to
 * @param oneTimePrekeyRetention how long an unused one-time private half is kept
 * @param oneTimePrekeyCapacity  most one-time private halves kept on the device
 */
@ConfigurationProperties(prefix = "cgraph.e2ee")
public record E2eeClientProperties(
        @DefaultValue("http://localhost:8080") String directoryBaseUrl,
        @DefaultValue("100") int oneTimePrekeyBatch,
        @DefaultValue("5m") Duration bundleCacheTtl,
        @DefaultValue("5m") Duration replenishInterval,
        @DefaultValue("20") int lowWaterMark,
        @DefaultValue("100") int highWaterMark,
        @DefaultValue("3") int directoryRetryAttempts,
        @DefaultValue("200ms") Duration directoryRetryBackoff,
        @DefaultValue("30d") Duration oneTimePrekeyRetention,
        @DefaultValue("1000") int oneTimePrekeyCapacity
) {

    public E2eeClientProperties {
        if (oneTimePrekeyCapacity < Math.max(oneTimePrekeyBatch, highWaterMark)) {
            throw new IllegalArgumentException(
                    "one-time-prekey-capacity must hold at least one full batch and the high water mark");
        }
    }

    public static E2eeClientProperties defaults() {
        return new E2eeClientProperties("http://localhost:8080", 100, Duration.ofMinutes(5),
                Duration.ofMinutes(5), 20, 100, 3, Duration.ofMillis(200), Duration.ofDays(30), 1000);
    }
}
