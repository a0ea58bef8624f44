package com.evidencevault.vault.cassandra;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface ExportSummaryRepository extends ReactiveCassandraRepository<ExportSummaryEntity, VaultChildKey> {

    Flux<ExportSummaryEntity> findAllByKeyVaultId(String vaultId);
}
