package com.evidencevault.vault;

import java.time.Instant;

/**
 * Vault-side trace of an export request. A new summary is appended for every
 * status the request reaches, so the list reads as the request's history.
 */
public record ExportSummary(
        String requestId,
        String requestType,
        String status,
        String actorId,
        Instant recordedAt
) {}
