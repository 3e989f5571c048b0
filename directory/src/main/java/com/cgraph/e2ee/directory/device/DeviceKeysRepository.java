package com.cgraph.e2ee.directory.device;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface DeviceKeysRepository extends ReactiveCassandraRepository<DeviceKeysEntity, DeviceKeysKey> {

    Flux<DeviceKeysEntity> findAllByKeyUserId(String userId);
}
