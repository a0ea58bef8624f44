package com.evidencevault.vault;

import java.util.List;

/**
 * Read view of the per-case aggregate: the stored record plus its ordered,
 * append-only collections.
 */
public record Vault(
        VaultRecord record,
        List<SealedEvidenceItem> items,
        List<AccessLogEntry> accessLog,
        List<ExportSummary> exportRequests
) {

    public Vault {
        items = List.copyOf(items);
        accessLog = List.copyOf(accessLog);
        exportRequests = List.copyOf(exportRequests);
    }

    public String id() {
        return record.id();
    }
}
