package com.evidencevault.retention;

import java.time.Instant;
import java.util.Set;

import com.evidencevault.vault.VaultRecord;

/**
 * A hold registered for one legal case. While {@code active}, every vault it
 * covers is excluded from retention deletion.
 *
 * @param vaultIds vaults listed at creation plus every vault a marker was placed on since
 */
public record LegalHoldCase(
        String caseId,
        HoldReason reason,
        HoldScope scope,
        Set<String> vaultIds,
        String counsel,
        String justification,
        boolean active,
        String createdBy,
        Instant createdAt,
        String closedBy,
        Instant closedAt
) {

    public LegalHoldCase {
        vaultIds = vaultIds == null ? Set.of() : Set.copyOf(vaultIds);
    }

    public boolean covers(VaultRecord vault) {
        return caseId.equals(vault.caseId())
                || vaultIds.contains(vault.id())
                || scope.covers(vault);
    }
}
