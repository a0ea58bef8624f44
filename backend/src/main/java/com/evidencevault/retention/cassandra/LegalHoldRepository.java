package com.evidencevault.retention.cassandra;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface LegalHoldRepository extends ReactiveCassandraRepository<LegalHoldEntity, String> {

    // served by legal_holds_active_idx
    Flux<LegalHoldEntity> findAllByActive(boolean active);
}
