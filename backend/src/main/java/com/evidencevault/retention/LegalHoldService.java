package com.evidencevault.retention;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.evidencevault.error.IllegalTransitionException;
import com.evidencevault.error.NotFoundException;
import com.evidencevault.error.ValidationException;
import com.evidencevault.event.VaultEvent;
import com.evidencevault.event.VaultEventPublisher;
import com.evidencevault.vault.VaultRecord;
import com.evidencevault.vault.VaultStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Registers and closes legal holds and keeps the hold markers on the protected
 * vaults in step with the registry.
 *
 * <p>A hold is active in the registry before any marker is placed, and
 * creation only completes once every covered vault carries its marker. The
 * retention delete is conditional on the marker count, so a hold that finishes
 * before the delete is attempted always wins.
 */
@Service
public class LegalHoldService {

    private static final Logger logger = LoggerFactory.getLogger(LegalHoldService.class);

    private final LegalHoldStore holdStore;
    private final VaultStore vaultStore;
    private final VaultEventPublisher events;
    private final Clock clock;

    public LegalHoldService(LegalHoldStore holdStore, VaultStore vaultStore,
                            VaultEventPublisher events, Clock clock) {
        this.holdStore = holdStore;
        this.vaultStore = vaultStore;
        this.events = events;
        this.clock = clock;
    }

    public Mono<LegalHoldCase> createLegalHoldCase(String caseId, HoldReason reason, HoldScope scope,
                                                   Set<String> vaultIds, String counsel,
                                                   String justification, String createdBy) {
        if (isBlank(caseId)) {
            return Mono.error(new ValidationException("Legal hold requires a case id"));
        }
        if (reason == null || scope == null) {
            return Mono.error(new ValidationException("Legal hold requires a reason and a scope"));
        }
        if (isBlank(counsel) || isBlank(justification)) {
            return Mono.error(new ValidationException("Legal hold requires counsel and a justification"));
        }

        LegalHoldCase hold = new LegalHoldCase(caseId, reason, scope, vaultIds, counsel, justification,
                true, createdBy, clock.instant(), null, null);

        return holdStore.insertIfAbsent(hold)
                .flatMap(inserted -> inserted ? Mono.just(hold) : reopen(hold))
                .flatMap(registered -> placeMarkers(registered)
                        .flatMap(protectedCount -> {
                            logger.info("Legal hold {} active ({}, scope {}): {} vault(s) protected",
                                    caseId, reason, scope, protectedCount);
                            events.publish(new VaultEvent.LegalHoldCreated(clock.instant(), caseId,
                                    reason.name(), scope.toString(), protectedCount.intValue()));
                            return getLegalHold(caseId);
                        }));
    }

    public Mono<LegalHoldCase> closeLegalHoldCase(String caseId, String closerId) {
        return holdStore.close(caseId, closerId, clock.instant())
                .flatMap(closed -> closed
                        ? getLegalHold(caseId)
                        : getLegalHold(caseId).flatMap(existing -> Mono.<LegalHoldCase>error(
                                new IllegalTransitionException("Legal hold " + caseId + " is already closed"))))
                // re-read after the close so markers placed concurrently are released too
                .flatMap(closed -> coveredVaults(closed)
                        .flatMap(vault -> vaultStore.removeHold(vault.id(), caseId))
                        .then(Mono.fromRunnable(() -> {
                            logger.info("Legal hold {} closed by {}", caseId, closerId);
                            events.publish(new VaultEvent.LegalHoldClosed(clock.instant(), caseId, closerId));
                        }))
                        .thenReturn(closed));
    }

    public Mono<LegalHoldCase> getLegalHold(String caseId) {
        return holdStore.findByCaseId(caseId)
                .switchIfEmpty(Mono.error(new NotFoundException("Legal hold", caseId)));
    }

    /**
     * Attaches markers for every active hold covering a freshly created vault.
     * A hold closed while this runs has its marker released again.
     */
    public Mono<Void> protectNewVault(VaultRecord vault) {
        return holdStore.findActive()
                .filter(hold -> hold.covers(vault))
                .concatMap(hold -> vaultStore.addHold(vault.id(), hold.caseId())
                        .filter(Boolean::booleanValue)
                        .flatMap(attached -> holdStore.addProtectedVault(hold.caseId(), vault.id()))
                        .then(holdStore.findByCaseId(hold.caseId()))
                        .filter(current -> !current.active())
                        .flatMap(closed -> vaultStore.removeHold(vault.id(), closed.caseId())))
                .then();
    }

    private Mono<LegalHoldCase> reopen(LegalHoldCase hold) {
        return holdStore.reopen(hold).flatMap(reopened -> {
            if (!reopened) {
                return Mono.error(new IllegalTransitionException(
                        "Legal hold " + hold.caseId() + " is already active"));
            }
            logger.info("Re-opening closed legal hold {}", hold.caseId());
            return Mono.just(hold);
        });
    }

    private Mono<Long> placeMarkers(LegalHoldCase hold) {
        return coveredVaults(hold)
                .concatMap(vault -> vaultStore.addHold(vault.id(), hold.caseId())
                        .flatMap(attached -> {
                            if (!attached) {
                                logger.warn("Vault {} was already committed for retention deletion; hold {} cannot protect it",
                                        vault.id(), hold.caseId());
                                return Mono.just(false);
                            }
                            return holdStore.addProtectedVault(hold.caseId(), vault.id()).thenReturn(true);
                        }))
                .filter(Boolean::booleanValue)
                .count();
    }

    private Flux<VaultRecord> coveredVaults(LegalHoldCase hold) {
        Flux<VaultRecord> byScope = switch (hold.scope().type()) {
            case GLOBAL -> vaultStore.findAll();
            case USER -> vaultStore.findBySubjectId(hold.scope().userId());
        };
        Flux<VaultRecord> listed = Flux.fromIterable(hold.vaultIds())
                .concatMap(vaultId -> vaultStore.findById(vaultId)
                        .switchIfEmpty(Mono.fromRunnable(() ->
                                logger.warn("Legal hold {} lists unknown vault {}", hold.caseId(), vaultId))));
        return Flux.concat(vaultStore.findByCaseId(hold.caseId()), listed, byScope)
                .distinct(VaultRecord::id);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
