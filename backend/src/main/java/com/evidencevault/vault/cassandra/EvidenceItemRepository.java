package com.evidencevault.vault.cassandra;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface EvidenceItemRepository extends ReactiveCassandraRepository<EvidenceItemEntity, VaultChildKey> {

    Flux<EvidenceItemEntity> findAllByKeyVaultId(String vaultId);
}
