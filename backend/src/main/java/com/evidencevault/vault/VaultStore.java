package com.evidencevault.vault;

import java.time.Instant;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence port for vaults. Every method that decides between competing
 * writers is a single atomic operation in the backing store; callers never
 * read-then-write to get those guarantees.
 */
public interface VaultStore {

    /**
     * Inserts {@code candidate} unless a vault already exists for its case id.
     * Emits the vault that owns the case afterwards and whether this call created it.
     */
    Mono<Insertion> insertIfAbsent(VaultRecord candidate);

    Mono<VaultRecord> findById(String vaultId);

    Mono<VaultRecord> findByCaseId(String caseId);

    Flux<VaultRecord> findBySubjectId(String subjectId);

    Flux<VaultRecord> findAll();

    /** Vaults whose hard-delete deadline is at or before {@code now}, including ones already purging. */
    Flux<VaultRecord> findHardDeleteDue(Instant now);

    /**
     * Adds an item to an existing vault that is not purging. Fails with
     * {@link com.evidencevault.error.IllegalTransitionException} otherwise, and
     * the item is not left behind.
     */
    Mono<Void> appendEvidence(String vaultId, SealedEvidenceItem item);

    /** Items in capture order. */
    Flux<SealedEvidenceItem> findEvidence(String vaultId);

    Mono<Void> appendAccessLog(String vaultId, AccessLogEntry entry);

    Flux<AccessLogEntry> findAccessLog(String vaultId);

    Mono<Void> appendExportSummary(String vaultId, ExportSummary summary);

    Flux<ExportSummary> findExportSummaries(String vaultId);

    /**
     * Attaches a hold marker. Emits false when the vault does not exist or is
     * already purging; re-attaching the same hold is a no-op that emits true.
     */
    Mono<Boolean> addHold(String vaultId, String holdCaseId);

    /** Detaches a hold marker; emits false when the vault does not exist. */
    Mono<Boolean> removeHold(String vaultId, String holdCaseId);

    /**
     * Commits retention deletion: sets the purging flag only if the vault carries
     * no hold marker, in one conditional write. Emits whether the flag is set.
     */
    Mono<Boolean> markPurgingIfUnheld(String vaultId);

    /**
     * Withdraws a deletion commit before any purge step ran. Emits false when the
     * vault does not exist or is not purging.
     */
    Mono<Boolean> cancelPurging(String vaultId);

    /**
     * Removes the evidence and the vault record of a purging vault. Access log
     * entries are kept. Safe to repeat after a partial failure.
     */
    Mono<Void> purge(String vaultId);

    record Insertion(VaultRecord vault, boolean created) {}
}
