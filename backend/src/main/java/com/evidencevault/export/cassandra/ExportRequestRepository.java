package com.evidencevault.export.cassandra;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface ExportRequestRepository extends ReactiveCassandraRepository<ExportRequestEntity, String> {

    // served by export_requests_vault_idx
    Flux<ExportRequestEntity> findAllByVaultId(String vaultId);
}
