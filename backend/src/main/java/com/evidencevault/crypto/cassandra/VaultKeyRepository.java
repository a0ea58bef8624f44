package com.evidencevault.crypto.cassandra;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface VaultKeyRepository extends ReactiveCassandraRepository<VaultKeyEntity, String> {
}
