package com.evidencevault.retention;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Component
@ConditionalOnProperty(prefix = "vault.store", name = "type", havingValue = "in-memory")
public class InMemoryLegalHoldStore implements LegalHoldStore {

    private final Map<String, LegalHoldCase> holds = new ConcurrentHashMap<>();

    @Override
    public Mono<Boolean> insertIfAbsent(LegalHoldCase hold) {
        return Mono.fromSupplier(() -> holds.putIfAbsent(hold.caseId(), hold) == null);
    }

    @Override
    public Mono<Boolean> reopen(LegalHoldCase hold) {
        return Mono.fromSupplier(() -> {
            AtomicBoolean applied = new AtomicBoolean(false);
            holds.computeIfPresent(hold.caseId(), (caseId, current) -> {
                if (current.active()) {
                    return current;
                }
                applied.set(true);
                return hold;
            });
            return applied.get();
        });
    }

    @Override
    public Mono<Boolean> close(String caseId, String closedBy, Instant closedAt) {
        return Mono.fromSupplier(() -> {
            AtomicBoolean applied = new AtomicBoolean(false);
            holds.computeIfPresent(caseId, (id, current) -> {
                if (!current.active()) {
                    return current;
                }
                applied.set(true);
                return new LegalHoldCase(current.caseId(), current.reason(), current.scope(), current.vaultIds(),
                        current.counsel(), current.justification(), false, current.createdBy(),
                        current.createdAt(), closedBy, closedAt);
            });
            return applied.get();
        });
    }

    @Override
    public Mono<LegalHoldCase> findByCaseId(String caseId) {
        return Mono.fromSupplier(() -> holds.get(caseId));
    }

    @Override
    public Flux<LegalHoldCase> findActive() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(holds.values())))
                .filter(LegalHoldCase::active);
    }

    @Override
    public Mono<Void> addProtectedVault(String caseId, String vaultId) {
        return Mono.fromRunnable(() -> holds.computeIfPresent(caseId, (id, current) -> {
            if (current.vaultIds().contains(vaultId)) {
                return current;
            }
            Set<String> vaultIds = new HashSet<>(current.vaultIds());
            vaultIds.add(vaultId);
            return new LegalHoldCase(current.caseId(), current.reason(), current.scope(), vaultIds,
                    current.counsel(), current.justification(), current.active(), current.createdBy(),
                    current.createdAt(), current.closedBy(), current.closedAt());
        }));
    }
}
