package com.evidencevault.vault.cassandra;

import java.time.Instant;

import org.springframework.data.cassandra.repository.Query;
import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface VaultRepository extends ReactiveCassandraRepository<VaultEntity, String> {

    // served by vaults_subject_idx
    Flux<VaultEntity> findAllBySubjectId(String subjectId);

    // background sweep only; a full scan is acceptable there
    @Query("SELECT * FROM vaults WHERE hard_delete_deadline <= ?0 ALLOW FILTERING")
    Flux<VaultEntity> findHardDeleteDue(Instant now);
}
