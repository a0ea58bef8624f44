package com.evidencevault.vault;

import java.time.Instant;

/**
 * One chain-of-custody record. Append-only: entries are never updated or
 * deleted, and they outlive the vault they describe.
 *
 * @param signature  HMAC over accessor, vault and timestamp
 * @param legalBasis the authority under which the access happened
 */
public record AccessLogEntry(
        String entryId,
        String vaultId,
        String accessorId,
        AccessAction action,
        Instant timestamp,
        String signature,
        String legalBasis,
        String detail
) {}
