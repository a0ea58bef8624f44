package com.evidencevault.export;

import com.evidencevault.vault.AccessLogEntry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence port for export requests.
 */
public interface ExportRequestStore {

    Mono<Void> insert(ExportRequest request);

    Mono<ExportRequest> findById(String requestId);

    Flux<ExportRequest> findByVaultId(String vaultId);

    /**
     * Replaces the stored request with {@code next} only if its status is still
     * {@code expected}. Emits whether the write was applied.
     */
    Mono<Boolean> compareAndSetStatus(ExportStatus expected, ExportRequest next);

    Mono<Void> appendAccessLog(String requestId, AccessLogEntry entry);

    /** Oldest first. */
    Flux<AccessLogEntry> findAccessLog(String requestId);
}
