package com.cgraph.e2ee.directory.prekey;

import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;

import java.io.Serializable;

/** One partition per device; prekeys cluster by id inside it. */
@PrimaryKeyClass
public record OneTimePrekeyKey(
    @PrimaryKeyColumn(name = "user_id", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    String userId,

    @PrimaryKeyColumn(name = "device_id", ordinal = 1, type = PrimaryKeyType.PARTITIONED)
    String deviceId,

    @PrimaryKeyColumn(name = "key_id", ordinal = 2, type = PrimaryKeyType.CLUSTERED)
    String keyId
) implements Serializable {}
