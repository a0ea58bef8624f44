package com.evidencevault.vault.cassandra;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface AccessLogRepository extends ReactiveCassandraRepository<AccessLogEntity, VaultChildKey> {

    Flux<AccessLogEntity> findAllByKeyVaultId(String vaultId);
}
