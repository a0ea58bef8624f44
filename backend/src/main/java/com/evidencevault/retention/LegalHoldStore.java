package com.evidencevault.retention;

import java.time.Instant;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence port for the hold registry. Status changes are conditional
 * writes so two administrators cannot both open or both close a hold.
 */
public interface LegalHoldStore {

    /** Emits true when no hold existed for the case id and this one was stored. */
    Mono<Boolean> insertIfAbsent(LegalHoldCase hold);

    /** Replaces a closed hold with {@code hold}; emits false when the stored one is active. */
    Mono<Boolean> reopen(LegalHoldCase hold);

    /** Deactivates the hold; emits false when it is missing or already closed. */
    Mono<Boolean> close(String caseId, String closedBy, Instant closedAt);

    Mono<LegalHoldCase> findByCaseId(String caseId);

    Flux<LegalHoldCase> findActive();

    /** Records a vault the hold has placed a marker on. Idempotent. */
    Mono<Void> addProtectedVault(String caseId, String vaultId);
}
