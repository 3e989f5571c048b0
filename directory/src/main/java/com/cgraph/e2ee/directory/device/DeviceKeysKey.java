package com.cgraph.e2ee.directory.device;

import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;

import java.io.Serializable;

@PrimaryKeyClass
public record DeviceKeysKey(
    @PrimaryKeyColumn(name = "user_id", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    String userId,

    @PrimaryKeyColumn(name = "device_id", ordinal = 1, type = PrimaryKeyType.CLUSTERED)
    String deviceId
) implements Serializable {}
