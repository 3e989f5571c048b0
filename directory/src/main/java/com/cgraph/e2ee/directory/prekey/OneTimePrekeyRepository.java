package com.cgraph.e2ee.directory.prekey;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface OneTimePrekeyRepository extends ReactiveCassandraRepository<OneTimePrekeyEntity, OneTimePrekeyKey> {

    Flux<OneTimePrekeyEntity> findAllByKeyUserIdAndKeyDeviceId(String userId, String deviceId);

    Mono<Long> countByKeyUserIdAndKeyDeviceId(String userId, String deviceId);
}
