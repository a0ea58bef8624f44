package com.evidencevault.vault;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import com.evidencevault.classification.Severity;
import com.evidencevault.classification.ViolationCategory;

/**
 * Scalar state of a vault as it is stored. Items, access log and export
 * summaries live in their own append-only collections.
 *
 * @param heldBy    case ids of the active legal holds protecting this vault
 * @param holdCount size of {@code heldBy}; the retention delete is conditional on it being zero
 * @param purging   set once retention deletion has been committed; no hold can attach afterwards
 */
public record VaultRecord(
        String id,
        String caseId,
        String reporterId,
        String subjectId,
        ViolationCategory category,
        Severity severity,
        Set<String> jurisdictions,
        Instant createdAt,
        Instant retentionDeadline,
        Instant hardDeleteDeadline,
        Set<String> heldBy,
        int holdCount,
        boolean purging
) {

    public VaultRecord {
        jurisdictions = jurisdictions == null ? Set.of() : Set.copyOf(jurisdictions);
        heldBy = heldBy == null ? Set.of() : Set.copyOf(heldBy);
    }

    public boolean isHeld() {
        return holdCount > 0;
    }

    public boolean isHardDeleteDue(Instant now) {
        return !hardDeleteDeadline.isAfter(now);
    }

    public VaultRecord withHold(String holdCaseId) {
        if (heldBy.contains(holdCaseId)) {
            return this;
        }
        Set<String> holds = new HashSet<>(heldBy);
        holds.add(holdCaseId);
        return copy(holds, purging);
    }

    public VaultRecord withoutHold(String holdCaseId) {
        if (!heldBy.contains(holdCaseId)) {
            return this;
        }
        Set<String> holds = new HashSet<>(heldBy);
        holds.remove(holdCaseId);
        return copy(holds, purging);
    }

    /** Same vault under another id; used when a case row already names the vault id. */
    public VaultRecord withId(String vaultId) {
        return new VaultRecord(vaultId, caseId, reporterId, subjectId, category, severity, jurisdictions,
                createdAt, retentionDeadline, hardDeleteDeadline, heldBy, holdCount, purging);
    }

    public VaultRecord markPurging() {
        return copy(heldBy, true);
    }

    public VaultRecord clearPurging() {
        return copy(heldBy, false);
    }

    private VaultRecord copy(Set<String> holds, boolean purgingFlag) {
        return new VaultRecord(id, caseId, reporterId, subjectId, category, severity, jurisdictions,
                createdAt, retentionDeadline, hardDeleteDeadline, holds, holds.size(), purgingFlag);
    }
}
