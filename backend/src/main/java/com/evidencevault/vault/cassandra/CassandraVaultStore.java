package com.evidencevault.vault.cassandra;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.cql.ReactiveCqlOperations;
import org.springframework.stereotype.Component;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.evidencevault.classification.Severity;
import com.evidencevault.classification.ViolationCategory;
import com.evidencevault.error.IllegalTransitionException;
import com.evidencevault.vault.AccessAction;
import com.evidencevault.vault.AccessLogEntry;
import com.evidencevault.vault.EvidenceKind;
import com.evidencevault.vault.ExportSummary;
import com.evidencevault.vault.SealedEvidenceItem;
import com.evidencevault.vault.VaultRecord;
import com.evidencevault.vault.VaultStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link VaultStore} over Cassandra. Every write to a {@code vaults} row is a
 * lightweight transaction, so competing writers are ordered by Paxos rather
 * than by last-write-wins timestamps.
 */
@Component
@ConditionalOnProperty(prefix = "vault.store", name = "type", havingValue = "cassandra", matchIfMissing = true)
public class CassandraVaultStore implements VaultStore {

    private static final Logger logger = LoggerFactory.getLogger(CassandraVaultStore.class);

    private static final int MAX_CAS_ATTEMPTS = 16;

    private static final String INSERT_CASE =
            "INSERT INTO vault_cases (case_id, vault_id) VALUES (?, ?) IF NOT EXISTS";
    private static final String INSERT_VAULT =
            "INSERT INTO vaults (id, case_id, reporter_id, subject_id, category, severity, jurisdictions, "
                    + "created_at, retention_deadline, hard_delete_deadline, held_by, hold_count, purging) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) IF NOT EXISTS";
    private static final String ADD_HOLD =
            "UPDATE vaults SET held_by = held_by + ?, hold_count = ? WHERE id = ? IF hold_count = ? AND purging = false";
    private static final String REMOVE_HOLD =
            "UPDATE vaults SET held_by = held_by - ?, hold_count = ? WHERE id = ? IF hold_count = ?";
    private static final String MARK_PURGING =
            "UPDATE vaults SET purging = true WHERE id = ? IF hold_count = 0";
    private static final String CANCEL_PURGING =
            "UPDATE vaults SET purging = false WHERE id = ? IF purging = true";
    private static final String DELETE_EVIDENCE = "DELETE FROM evidence_items WHERE vault_id = ?";
    private static final String DELETE_ITEM = "DELETE FROM evidence_items WHERE vault_id = ? AND id = ?";
    private static final String DELETE_EXPORTS = "DELETE FROM vault_exports WHERE vault_id = ?";
    private static final String DELETE_CASE = "DELETE FROM vault_cases WHERE case_id = ? IF vault_id = ?";
    private static final String DELETE_VAULT = "DELETE FROM vaults WHERE id = ? IF purging = true";

    private final VaultRepository vaults;
    private final VaultCaseRepository cases;
    private final EvidenceItemRepository evidence;
    private final AccessLogRepository accessLog;
    private final ExportSummaryRepository exports;
    private final ReactiveCqlOperations cql;

    public CassandraVaultStore(VaultRepository vaults,
                               VaultCaseRepository cases,
                               EvidenceItemRepository evidence,
                               AccessLogRepository accessLog,
                               ExportSummaryRepository exports,
                               ReactiveCassandraOperations operations) {
        this.vaults = vaults;
        this.cases = cases;
        this.evidence = evidence;
        this.accessLog = accessLog;
        this.exports = exports;
        this.cql = operations.getReactiveCqlOperations();
    }

    @Override
    public Mono<Insertion> insertIfAbsent(VaultRecord candidate) {
        // the case row decides the vault id; the vault row is then created by
        // whoever gets there first, which also repairs a creator that died in between
        return cql.execute(INSERT_CASE, candidate.caseId(), candidate.id())
                .then(cases.findById(candidate.caseId()))
                .map(VaultCaseEntity::getVaultId)
                .flatMap(vaultId -> {
                    VaultRecord row = candidate.withId(vaultId);
                    return cql.execute(INSERT_VAULT,
                                    row.id(), row.caseId(), row.reporterId(), row.subjectId(),
                                    name(row.category()), name(row.severity()), row.jurisdictions(),
                                    row.createdAt(), row.retentionDeadline(), row.hardDeleteDeadline(),
                                    row.heldBy(), row.holdCount(), row.purging())
                            .flatMap(created -> created
                                    ? Mono.just(new Insertion(row, true))
                                    : findById(vaultId).map(existing -> new Insertion(existing, false)));
                })
                .switchIfEmpty(Mono.error(() -> new IllegalTransitionException(
                        "Vault for case " + candidate.caseId() + " was removed during creation")));
    }

    @Override
    public Mono<VaultRecord> findById(String vaultId) {
        return vaults.findById(vaultId).map(CassandraVaultStore::toRecord);
    }

    @Override
    public Mono<VaultRecord> findByCaseId(String caseId) {
        return cases.findById(caseId)
                .flatMap(row -> findById(row.getVaultId()));
    }

    @Override
    public Flux<VaultRecord> findBySubjectId(String subjectId) {
        return vaults.findAllBySubjectId(subjectId).map(CassandraVaultStore::toRecord);
    }

    @Override
    public Flux<VaultRecord> findAll() {
        return vaults.findAll().map(CassandraVaultStore::toRecord);
    }

    @Override
    public Flux<VaultRecord> findHardDeleteDue(Instant now) {
        return vaults.findHardDeleteDue(now).map(CassandraVaultStore::toRecord);
    }

    @Override
    public Mono<Void> appendEvidence(String vaultId, SealedEvidenceItem item) {
        EvidenceItemEntity entity = new EvidenceItemEntity();
        entity.setKey(new VaultChildKey(vaultId, UUID.fromString(item.id())));
        entity.setKind(item.kind().name());
        entity.setCiphertext(ByteBuffer.wrap(item.ciphertext()));
        entity.setIv(ByteBuffer.wrap(item.iv()));
        entity.setAuthTag(ByteBuffer.wrap(item.authTag()));
        entity.setKeyId(item.keyId());
        entity.setChecksum(item.checksum());
        entity.setConversationId(item.conversationId());
        entity.setMessageId(item.messageId());
        entity.setCapturedBy(item.capturedBy());
        entity.setRelevanceScore(item.relevanceScore());
        entity.setLegalReferences(item.legalReferences());
        entity.setCapturedAt(item.capturedAt());
        // written first, then checked: a purge committed after the check deletes the whole partition
        return evidence.save(entity)
                .then(findById(vaultId))
                .filter(vault -> !vault.purging())
                .switchIfEmpty(Mono.defer(() -> {
                    logger.warn("Evidence {} arrived for vault {} while it was gone or being deleted; removing it",
                            item.id(), vaultId);
                    return cql.execute(DELETE_ITEM, vaultId, UUID.fromString(item.id()))
                            .then(Mono.<VaultRecord>error(new IllegalTransitionException(
                                    "Vault " + vaultId + " is gone or being deleted")));
                }))
                .then();
    }

    @Override
    public Flux<SealedEvidenceItem> findEvidence(String vaultId) {
        return evidence.findAllByKeyVaultId(vaultId)
                .map(e -> new SealedEvidenceItem(
                        e.getKey().id().toString(),
                        EvidenceKind.valueOf(e.getKind()),
                        bytes(e.getCiphertext()),
                        bytes(e.getIv()),
                        bytes(e.getAuthTag()),
                        e.getKeyId(),
                        e.getChecksum(),
                        e.getConversationId(),
                        e.getMessageId(),
                        e.getCapturedBy(),
                        e.getRelevanceScore(),
                        e.getLegalReferences(),
                        e.getCapturedAt()));
    }

    @Override
    public Mono<Void> appendAccessLog(String vaultId, AccessLogEntry entry) {
        AccessLogEntity entity = new AccessLogEntity();
        entity.setKey(new VaultChildKey(vaultId, UUID.fromString(entry.entryId())));
        entity.setAccessorId(entry.accessorId());
        entity.setAction(entry.action().name());
        entity.setAccessedAt(entry.timestamp());
        entity.setSignature(entry.signature());
        entity.setLegalBasis(entry.legalBasis());
        entity.setDetail(entry.detail());
        return accessLog.save(entity).then();
    }

    @Override
    public Flux<AccessLogEntry> findAccessLog(String vaultId) {
        return accessLog.findAllByKeyVaultId(vaultId)
                .map(e -> new AccessLogEntry(
                        e.getKey().id().toString(),
                        e.getKey().vaultId(),
                        e.getAccessorId(),
                        AccessAction.valueOf(e.getAction()),
                        e.getAccessedAt(),
                        e.getSignature(),
                        e.getLegalBasis(),
                        e.getDetail()));
    }

    @Override
    public Mono<Void> appendExportSummary(String vaultId, ExportSummary summary) {
        ExportSummaryEntity entity = new ExportSummaryEntity();
        entity.setKey(new VaultChildKey(vaultId, Uuids.timeBased()));
        entity.setRequestId(summary.requestId());
        entity.setRequestType(summary.requestType());
        entity.setStatus(summary.status());
        entity.setActorId(summary.actorId());
        entity.setRecordedAt(summary.recordedAt());
        return exports.save(entity).then();
    }

    @Override
    public Flux<ExportSummary> findExportSummaries(String vaultId) {
        return exports.findAllByKeyVaultId(vaultId)
                .map(e -> new ExportSummary(e.getRequestId(), e.getRequestType(), e.getStatus(),
                        e.getActorId(), e.getRecordedAt()));
    }

    @Override
    public Mono<Boolean> addHold(String vaultId, String holdCaseId) {
        return addHold(vaultId, holdCaseId, 1);
    }

    private Mono<Boolean> addHold(String vaultId, String holdCaseId, int attempt) {
        return findById(vaultId)
                .flatMap(vault -> {
                    if (vault.purging()) {
                        return Mono.just(false);
                    }
                    if (vault.heldBy().contains(holdCaseId)) {
                        return Mono.just(true);
                    }
                    return cql.execute(ADD_HOLD, Set.of(holdCaseId), vault.holdCount() + 1, vaultId, vault.holdCount())
                            .flatMap(applied -> applied
                                    ? Mono.just(true)
                                    : retry(vaultId, attempt, () -> addHold(vaultId, holdCaseId, attempt + 1)));
                })
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Boolean> removeHold(String vaultId, String holdCaseId) {
        return removeHold(vaultId, holdCaseId, 1);
    }

    private Mono<Boolean> removeHold(String vaultId, String holdCaseId, int attempt) {
        return findById(vaultId)
                .flatMap(vault -> {
                    if (!vault.heldBy().contains(holdCaseId)) {
                        return Mono.just(true);
                    }
                    return cql.execute(REMOVE_HOLD, Set.of(holdCaseId), vault.holdCount() - 1, vaultId, vault.holdCount())
                            .flatMap(applied -> applied
                                    ? Mono.just(true)
                                    : retry(vaultId, attempt, () -> removeHold(vaultId, holdCaseId, attempt + 1)));
                })
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Boolean> markPurgingIfUnheld(String vaultId) {
        return cql.execute(MARK_PURGING, vaultId);
    }

    @Override
    public Mono<Boolean> cancelPurging(String vaultId) {
        return cql.execute(CANCEL_PURGING, vaultId);
    }

    @Override
    public Mono<Void> purge(String vaultId) {
        return findById(vaultId)
                .flatMap(vault -> {
                    if (!vault.purging()) {
                        return Mono.error(new IllegalTransitionException(
                                "Vault " + vaultId + " has not been committed for deletion"));
                    }
                    // vault row last: while it exists the purge can be resumed
                    return cql.execute(DELETE_EVIDENCE, vaultId)
                            .then(cql.execute(DELETE_EXPORTS, vaultId))
                            .then(cql.execute(DELETE_CASE, vault.caseId(), vaultId))
                            .then(cql.execute(DELETE_VAULT, vaultId));
                })
                .then();
    }

    private Mono<Boolean> retry(String vaultId, int attempt, Supplier<Mono<Boolean>> next) {
        if (attempt >= MAX_CAS_ATTEMPTS) {
            return Mono.error(new IllegalStateException(
                    "Gave up updating hold markers on vault " + vaultId + " after " + attempt + " attempts"));
        }
        logger.debug("Hold marker CAS lost on vault {} (attempt {}), retrying", vaultId, attempt);
        return Mono.defer(next);
    }

    private static VaultRecord toRecord(VaultEntity e) {
        return new VaultRecord(
                e.getId(),
                e.getCaseId(),
                e.getReporterId(),
                e.getSubjectId(),
                e.getCategory() == null ? null : ViolationCategory.valueOf(e.getCategory()),
                e.getSeverity() == null ? null : Severity.valueOf(e.getSeverity()),
                e.getJurisdictions(),
                e.getCreatedAt(),
                e.getRetentionDeadline(),
                e.getHardDeleteDeadline(),
                e.getHeldBy(),
                e.getHoldCount(),
                e.isPurging());
    }

    private static String name(Enum<?> value) {
        return value == null ? null : value.name();
    }

    private static byte[] bytes(ByteBuffer buffer) {
        if (buffer == null) {
            return new byte[0];
        }
        ByteBuffer copy = buffer.duplicate();
        byte[] out = new byte[copy.remaining()];
        copy.get(out);
        return out;
    }
}
