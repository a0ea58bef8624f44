package com.evidencevault.vault;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.evidencevault.error.IllegalTransitionException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link VaultStore} kept in process memory. Each conditional write is a single
 * {@link ConcurrentHashMap} compute on the vault's entry.
 */
@Component
@ConditionalOnProperty(prefix = "vault.store", name = "type", havingValue = "in-memory")
public class InMemoryVaultStore implements VaultStore {

    private final Map<String, VaultRecord> vaults = new ConcurrentHashMap<>();
    private final Map<String, String> cases = new ConcurrentHashMap<>();
    private final Map<String, List<SealedEvidenceItem>> evidence = new ConcurrentHashMap<>();
    private final Map<String, List<AccessLogEntry>> accessLog = new ConcurrentHashMap<>();
    private final Map<String, List<ExportSummary>> exports = new ConcurrentHashMap<>();

    @Override
    public Mono<Insertion> insertIfAbsent(VaultRecord candidate) {
        return Mono.fromSupplier(() -> {
            String vaultId = cases.computeIfAbsent(candidate.caseId(), caseId -> candidate.id());
            VaultRecord row = candidate.withId(vaultId);
            VaultRecord existing = vaults.putIfAbsent(vaultId, row);
            return existing == null ? new Insertion(row, true) : new Insertion(existing, false);
        });
    }

    @Override
    public Mono<VaultRecord> findById(String vaultId) {
        return Mono.fromSupplier(() -> vaults.get(vaultId));
    }

    @Override
    public Mono<VaultRecord> findByCaseId(String caseId) {
        return Mono.fromSupplier(() -> cases.get(caseId)).flatMap(this::findById);
    }

    @Override
    public Flux<VaultRecord> findBySubjectId(String subjectId) {
        return findAll().filter(vault -> subjectId.equals(vault.subjectId()));
    }

    @Override
    public Flux<VaultRecord> findAll() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(vaults.values())));
    }

    @Override
    public Flux<VaultRecord> findHardDeleteDue(Instant now) {
        return findAll().filter(vault -> vault.isHardDeleteDue(now));
    }

    @Override
    public Mono<Void> appendEvidence(String vaultId, SealedEvidenceItem item) {
        return Mono.fromRunnable(() -> {
            // appended under the vault's entry so it cannot interleave with the deletion commit
            VaultRecord vault = vaults.computeIfPresent(vaultId, (id, current) -> {
                if (!current.purging()) {
                    append(evidence, vaultId, item);
                }
                return current;
            });
            if (vault == null || vault.purging()) {
                throw new IllegalTransitionException("Vault " + vaultId + " is gone or being deleted");
            }
        });
    }

    @Override
    public Flux<SealedEvidenceItem> findEvidence(String vaultId) {
        return snapshot(evidence, vaultId);
    }

    @Override
    public Mono<Void> appendAccessLog(String vaultId, AccessLogEntry entry) {
        return Mono.fromRunnable(() -> append(accessLog, vaultId, entry));
    }

    @Override
    public Flux<AccessLogEntry> findAccessLog(String vaultId) {
        return snapshot(accessLog, vaultId);
    }

    @Override
    public Mono<Void> appendExportSummary(String vaultId, ExportSummary summary) {
        return Mono.fromRunnable(() -> append(exports, vaultId, summary));
    }

    @Override
    public Flux<ExportSummary> findExportSummaries(String vaultId) {
        return snapshot(exports, vaultId);
    }

    @Override
    public Mono<Boolean> addHold(String vaultId, String holdCaseId) {
        return Mono.fromSupplier(() -> {
            AtomicBoolean attached = new AtomicBoolean(false);
            vaults.computeIfPresent(vaultId, (id, vault) -> {
                if (vault.purging()) {
                    return vault;
                }
                attached.set(true);
                return vault.withHold(holdCaseId);
            });
            return attached.get();
        });
    }

    @Override
    public Mono<Boolean> removeHold(String vaultId, String holdCaseId) {
        return Mono.fromSupplier(() ->
                vaults.computeIfPresent(vaultId, (id, vault) -> vault.withoutHold(holdCaseId)) != null);
    }

    @Override
    public Mono<Boolean> markPurgingIfUnheld(String vaultId) {
        return Mono.fromSupplier(() -> {
            VaultRecord after = vaults.computeIfPresent(vaultId,
                    (id, vault) -> vault.isHeld() ? vault : vault.markPurging());
            return after != null && after.purging();
        });
    }

    @Override
    public Mono<Boolean> cancelPurging(String vaultId) {
        return Mono.fromSupplier(() -> {
            AtomicBoolean cancelled = new AtomicBoolean(false);
            vaults.computeIfPresent(vaultId, (id, vault) -> {
                if (!vault.purging()) {
                    return vault;
                }
                cancelled.set(true);
                return vault.clearPurging();
            });
            return cancelled.get();
        });
    }

    @Override
    public Mono<Void> purge(String vaultId) {
        return Mono.fromRunnable(() -> {
            VaultRecord vault = vaults.get(vaultId);
            if (vault == null) {
                return;
            }
            if (!vault.purging()) {
                throw new IllegalTransitionException("Vault " + vaultId + " has not been committed for deletion");
            }
            evidence.remove(vaultId);
            exports.remove(vaultId);
            cases.remove(vault.caseId(), vaultId);
            vaults.remove(vaultId, vault);
        });
    }

    private static <T> void append(Map<String, List<T>> table, String vaultId, T value) {
        table.computeIfAbsent(vaultId, id -> new CopyOnWriteArrayList<>()).add(value);
    }

    private static <T> Flux<T> snapshot(Map<String, List<T>> table, String vaultId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(table.getOrDefault(vaultId, List.of()))));
    }
}
