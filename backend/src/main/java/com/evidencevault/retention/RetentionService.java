package com.evidencevault.retention;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.evidencevault.event.VaultEvent;
import com.evidencevault.event.VaultEventPublisher;
import com.evidencevault.retention.SweepReport.Outcome;
import com.evidencevault.retention.SweepReport.Status;
import com.evidencevault.vault.VaultRecord;
import com.evidencevault.vault.VaultStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Retention sweep. Deletes vaults past their hard-delete deadline unless a
 * legal hold protects them.
 *
 * <p>The registry read at the start of the sweep only decides what to log.
 * Deletion is committed by {@link VaultStore#markPurgingIfUnheld}, which refuses
 * when any hold marker is present at that instant. The registry is then read
 * again: a hold stored before that read whose markers are not placed yet
 * withdraws the commit and is marked on the vault. A hold stored after it is
 * ordered after the deletion.
 */
@Service
public class RetentionService {

    private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);

    private final VaultStore vaultStore;
    private final LegalHoldStore holdStore;
    private final VaultEventPublisher events;
    private final Clock clock;

    public RetentionService(VaultStore vaultStore, LegalHoldStore holdStore,
                            VaultEventPublisher events, Clock clock) {
        this.vaultStore = vaultStore;
        this.holdStore = holdStore;
        this.events = events;
        this.clock = clock;
    }

    public Mono<SweepReport> expireVaults() {
        Instant now = clock.instant();
        return holdStore.findActive().collectList()
                .flatMap(activeHolds -> vaultStore.findHardDeleteDue(now)
                        // one vault at a time; a failure is recorded and the sweep moves on
                        .concatMap(vault -> expire(vault, activeHolds)
                                .onErrorResume(e -> {
                                    logger.error("Retention sweep failed for vault {}: {}", vault.id(), e.getMessage(), e);
                                    return Mono.just(new Outcome(vault.id(), vault.caseId(), Status.FAILED, e.getMessage()));
                                }))
                        .collectList())
                .map(SweepReport::new)
                .doOnNext(report -> logger.info("Retention sweep: {} deleted, {} held, {} failed",
                        report.deleted().size(), report.skipped().size(), report.failed().size()));
    }

    private Mono<Outcome> expire(VaultRecord vault, List<LegalHoldCase> activeHolds) {
        if (vault.purging()) {
            // deletion was committed by an earlier sweep that did not finish
            logger.warn("Resuming interrupted purge of vault {}", vault.id());
            return purge(vault);
        }

        Set<String> holding = new TreeSet<>(vault.heldBy());
        activeHolds.stream()
                .filter(hold -> hold.covers(vault))
                .map(LegalHoldCase::caseId)
                .forEach(holding::add);
        if (!holding.isEmpty()) {
            return Mono.just(skip(vault, holding));
        }

        return vaultStore.markPurgingIfUnheld(vault.id())
                .flatMap(committed -> committed
                        ? purgeUnlessRegistered(vault)
                        : vaultStore.findById(vault.id())
                                .map(current -> skip(vault, current.heldBy()))
                                .defaultIfEmpty(new Outcome(vault.id(), vault.caseId(), Status.FAILED,
                                        "vault disappeared during sweep")));
    }

    private Mono<Outcome> purgeUnlessRegistered(VaultRecord vault) {
        return holdStore.findActive()
                .filter(hold -> hold.covers(vault))
                .collectList()
                .flatMap(late -> late.isEmpty() ? purge(vault) : withdraw(vault, late));
    }

    private Mono<Outcome> withdraw(VaultRecord vault, List<LegalHoldCase> holds) {
        Set<String> holding = new TreeSet<>();
        holds.forEach(hold -> holding.add(hold.caseId()));
        logger.warn("Vault {} was committed for deletion while holds {} were being placed; withdrawing",
                vault.id(), holding);
        return vaultStore.cancelPurging(vault.id())
                .flatMap(cancelled -> {
                    if (!cancelled) {
                        return Mono.error(new IllegalStateException(
                                "Deletion of vault " + vault.id() + " could not be withdrawn"));
                    }
                    return Flux.fromIterable(holds)
                            .concatMap(hold -> vaultStore.addHold(vault.id(), hold.caseId())
                                    .filter(Boolean::booleanValue)
                                    .flatMap(attached -> holdStore.addProtectedVault(hold.caseId(), vault.id())))
                            .then(Mono.fromCallable(() -> skip(vault, holding)));
                });
    }

    private Outcome skip(VaultRecord vault, Set<String> holdingCases) {
        logger.info("Retention skip for vault {} (case {}): held by {}", vault.id(), vault.caseId(), holdingCases);
        return new Outcome(vault.id(), vault.caseId(), Status.SKIPPED_HELD, "held by " + holdingCases);
    }

    private Mono<Outcome> purge(VaultRecord vault) {
        return vaultStore.purge(vault.id())
                .then(Mono.fromCallable(() -> {
                    logger.info("Vault {} (case {}) deleted by retention", vault.id(), vault.caseId());
                    events.publish(new VaultEvent.VaultExpired(clock.instant(), vault.id(), vault.caseId()));
                    return new Outcome(vault.id(), vault.caseId(), Status.DELETED, null);
                }));
    }
}
