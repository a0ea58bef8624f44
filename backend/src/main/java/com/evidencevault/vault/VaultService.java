package com.evidencevault.vault;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.evidencevault.classification.ClassificationContext;
import com.evidencevault.classification.ClassificationEngine;
import com.evidencevault.classification.ClassificationResult;
import com.evidencevault.classification.Severity;
import com.evidencevault.classification.ViolationCategory;
import com.evidencevault.config.VaultProperties;
import com.evidencevault.crypto.SealingService;
import com.evidencevault.error.IllegalTransitionException;
import com.evidencevault.error.NotFoundException;
import com.evidencevault.error.ValidationException;
import com.evidencevault.event.VaultEvent;
import com.evidencevault.event.VaultEventPublisher;
import com.evidencevault.retention.LegalHoldService;

import reactor.core.publisher.Mono;

/**
 * Entry point for evidence capture and the per-case vault aggregate.
 *
 * <p><strong>Privacy contract:</strong> content is classified before anything
 * else happens. Unless the verdict is {@code STORE_EVIDENCE} the content is
 * dropped here; it never reaches the sealing service, the store, a log line or
 * an event.
 */
@Service
public class VaultService {

    private static final Logger logger = LoggerFactory.getLogger(VaultService.class);

    private final ClassificationEngine classifier;
    private final SealingService sealingService;
    private final VaultStore store;
    private final CustodyLog custodyLog;
    private final LegalHoldService legalHoldService;
    private final VaultEventPublisher events;
    private final VaultProperties.Retention retention;
    private final Clock clock;

    public VaultService(ClassificationEngine classifier,
                        SealingService sealingService,
                        VaultStore store,
                        CustodyLog custodyLog,
                        LegalHoldService legalHoldService,
                        VaultEventPublisher events,
                        VaultProperties properties,
                        Clock clock) {
        this.classifier = classifier;
        this.sealingService = sealingService;
        this.store = store;
        this.custodyLog = custodyLog;
        this.legalHoldService = legalHoldService;
        this.events = events;
        this.retention = properties.retention();
        this.clock = clock;
    }

    /**
     * Idempotent per case id: concurrent and repeated calls all emit the id of
     * the single vault owning the case.
     */
    public Mono<String> getOrCreateVault(String caseId, String reporterId, String subjectId,
                                         ViolationCategory category, Severity severity,
                                         Set<String> jurisdictions) {
        if (isBlank(caseId) || isBlank(subjectId)) {
            return Mono.error(new ValidationException("caseId and subjectId are required"));
        }
        Instant now = clock.instant();
        Instant retentionDeadline = now.plus(retention.retentionPeriod());
        VaultRecord candidate = new VaultRecord(
                VaultIds.vaultId(caseId, subjectId),
                caseId,
                reporterId,
                subjectId,
                category,
                severity,
                jurisdictions,
                now,
                retentionDeadline,
                retentionDeadline.plus(retention.gracePeriod()),
                Set.of(),
                0,
                false);

        return store.insertIfAbsent(candidate)
                .flatMap(insertion -> {
                    VaultRecord vault = insertion.vault();
                    if (!insertion.created()) {
                        return Mono.just(vault.id());
                    }
                    logger.info("Created vault {} for case {} ({} / {})", vault.id(), caseId, category, severity);
                    return legalHoldService.protectNewVault(vault).thenReturn(vault.id());
                });
    }

    /**
     * Classifies, and only for {@code STORE_EVIDENCE} seals the content into the
     * case vault. Emits nothing for every other verdict.
     */
    public Mono<CaptureReceipt> captureQualifyingContent(CaptureRequest request) {
        ClassificationContext context = request.context();
        ClassificationResult verdict = classifier.classify(request.content(), context);

        switch (verdict.decision()) {
            case PROTECT_PRIVACY:
            case NO_VIOLATION:
                return Mono.empty();
            case REQUIRES_REVIEW:
                events.publish(new VaultEvent.ReviewRequired(clock.instant(), context.conversationId(),
                        context.messageId(), verdict.category().name(), verdict.confidence()));
                return Mono.empty();
            case STORE_EVIDENCE:
                break;
        }

        String subjectId = context.senderId();
        String caseId = request.caseId() != null
                ? request.caseId()
                : VaultIds.caseId(request.reporterId(), subjectId);
        EvidenceMetadata metadata = new EvidenceMetadata(
                request.kind() != null ? request.kind() : EvidenceKind.MESSAGE,
                context.conversationId(),
                context.messageId(),
                request.capturedBy(),
                verdict.confidence(),
                verdict.triggeredLegalReferences());

        return getOrCreateVault(caseId, request.reporterId(), subjectId,
                        verdict.category(), verdict.severity(), context.jurisdictions())
                .flatMap(vaultId -> sealingService
                        .seal(request.content().getBytes(StandardCharsets.UTF_8), metadata)
                        .flatMap(item -> appendEvidence(vaultId, item)
                                .map(evidenceId -> new CaptureReceipt(vaultId, evidenceId))))
                .doOnNext(receipt -> events.publish(new VaultEvent.EvidenceCaptured(clock.instant(),
                        receipt.vaultId(), caseId, receipt.evidenceId(),
                        verdict.category().name(), verdict.severity().name())));
    }

    /** Appends a sealed item; the item is immutable from here on. */
    public Mono<String> appendEvidence(String vaultId, SealedEvidenceItem item) {
        return requireVault(vaultId)
                .flatMap(vault -> {
                    if (vault.purging()) {
                        return Mono.error(new IllegalTransitionException(
                                "Vault " + vaultId + " is being purged; evidence cannot be appended"));
                    }
                    return store.appendEvidence(vaultId, item)
                            .then(custodyLog.append(vaultId, item.capturedBy(), AccessAction.EVIDENCE_SEALED,
                                    "capture", "evidence " + item.id()))
                            .thenReturn(item.id());
                });
    }

    /** Full aggregate. Viewing is itself a logged custody event. */
    public Mono<Vault> getVault(String vaultId, String accessorId, String legalBasis) {
        return requireVault(vaultId)
                .flatMap(record -> custodyLog.append(vaultId, accessorId, AccessAction.METADATA_VIEWED,
                                legalBasis, null)
                        .then(Mono.zip(
                                store.findEvidence(vaultId).collectList(),
                                store.findAccessLog(vaultId).collectList(),
                                store.findExportSummaries(vaultId).collectList()))
                        .map(parts -> new Vault(record, parts.getT1(), parts.getT2(), parts.getT3())));
    }

    public Mono<VaultRecord> findVaultByCase(String caseId) {
        return store.findByCaseId(caseId)
                .switchIfEmpty(Mono.error(new NotFoundException("Vault for case", caseId)));
    }

    Mono<VaultRecord> requireVault(String vaultId) {
        return store.findById(vaultId)
                .switchIfEmpty(Mono.error(new NotFoundException("Vault", vaultId)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
