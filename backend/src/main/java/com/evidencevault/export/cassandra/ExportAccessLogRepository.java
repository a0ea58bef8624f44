package com.evidencevault.export.cassandra;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface ExportAccessLogRepository extends ReactiveCassandraRepository<ExportAccessLogEntity, ExportAccessLogKey> {

    Flux<ExportAccessLogEntity> findAllByKeyRequestId(String requestId);
}
