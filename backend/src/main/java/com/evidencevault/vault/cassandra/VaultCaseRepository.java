package com.evidencevault.vault.cassandra;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VaultCaseRepository extends ReactiveCassandraRepository<VaultCaseEntity, String> {
}
