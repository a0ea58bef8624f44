package com.evidencevault.vault;

import java.time.Clock;
import java.time.Instant;

import org.springframework.stereotype.Component;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.evidencevault.crypto.AccessSigner;

import reactor.core.publisher.Mono;

/**
 * Creates signed {@link AccessLogEntry} records and appends them to a vault's
 * chain of custody.
 */
@Component
public class CustodyLog {

    private final VaultStore store;
    private final AccessSigner signer;
    private final Clock clock;

    public CustodyLog(VaultStore store, AccessSigner signer, Clock clock) {
        this.store = store;
        this.signer = signer;
        this.clock = clock;
    }

    public AccessLogEntry entry(String vaultId, String accessorId, AccessAction action,
                                String legalBasis, String detail) {
        Instant now = clock.instant();
        return new AccessLogEntry(
                Uuids.timeBased().toString(),
                vaultId,
                accessorId,
                action,
                now,
                signer.sign(accessorId, vaultId, now),
                legalBasis,
                detail);
    }

    public Mono<AccessLogEntry> append(String vaultId, String accessorId, AccessAction action,
                                       String legalBasis, String detail) {
        AccessLogEntry entry = entry(vaultId, accessorId, action, legalBasis, detail);
        return store.appendAccessLog(vaultId, entry).thenReturn(entry);
    }

    public boolean verify(AccessLogEntry entry) {
        return signer.verify(entry.accessorId(), entry.vaultId(), entry.timestamp(), entry.signature());
    }
}
