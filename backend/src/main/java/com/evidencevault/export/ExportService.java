package com.evidencevault.export;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.evidencevault.crypto.SealingService;
import com.evidencevault.error.IllegalTransitionException;
import com.evidencevault.error.IntegrityException;
import com.evidencevault.error.NotFoundException;
import com.evidencevault.error.PermissionDeniedException;
import com.evidencevault.error.ValidationException;
import com.evidencevault.event.VaultEvent;
import com.evidencevault.event.VaultEventPublisher;
import com.evidencevault.export.ExportPackage.DeliveredItem;
import com.evidencevault.export.ExportPackage.WithheldItem;
import com.evidencevault.vault.AccessAction;
import com.evidencevault.vault.AccessLogEntry;
import com.evidencevault.vault.CustodyLog;
import com.evidencevault.vault.ExportSummary;
import com.evidencevault.vault.SealedEvidenceItem;
import com.evidencevault.vault.VaultRecord;
import com.evidencevault.vault.VaultStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Request, approval and delivery of vault evidence to courts, law enforcement
 * or the parties themselves. Every status change is a compare-and-set on the
 * stored request, so of two concurrent administrator actions exactly one wins.
 */
@Service
public class ExportService {

    private static final Logger logger = LoggerFactory.getLogger(ExportService.class);

    private final ExportRequestStore requests;
    private final VaultStore vaults;
    private final SealingService sealingService;
    private final CustodyLog custodyLog;
    private final VaultEventPublisher events;
    private final Clock clock;

    public ExportService(ExportRequestStore requests, VaultStore vaults, SealingService sealingService,
                         CustodyLog custodyLog, VaultEventPublisher events, Clock clock) {
        this.requests = requests;
        this.vaults = vaults;
        this.sealingService = sealingService;
        this.custodyLog = custodyLog;
        this.events = events;
        this.clock = clock;
    }

    public Mono<ExportRequest> requestExport(String vaultId, String requesterId, ExportRequestType type,
                                             SupportingReference reference, String recipient) {
        try {
            validate(requesterId, type, reference, recipient);
        } catch (ValidationException e) {
            return Mono.error(e);
        }

        return requireVault(vaultId).flatMap(vault -> {
            if (type == ExportRequestType.USER_DATA_REQUEST
                    && !requesterId.equals(vault.subjectId()) && !requesterId.equals(vault.reporterId())) {
                return Mono.error(new PermissionDeniedException(
                        "User " + requesterId + " is not a party to vault " + vaultId));
            }
            Instant now = clock.instant();
            ExportRequest request = new ExportRequest(
                    Uuids.timeBased().toString(), vaultId, type, requesterId, reference, recipient,
                    ExportStatus.PENDING, null, null, null, null, now, now, List.of());

            return requests.insert(request)
                    .then(record(request, requesterId, AccessAction.EXPORT_REQUESTED, "requested by " + requesterId))
                    .map(entry -> {
                        logger.info("Export {} requested for vault {} ({})", request.id(), vaultId, type);
                        events.publish(new VaultEvent.ExportRequested(now, request.id(), vaultId,
                                type.name(), requesterId));
                        return request.withAccessLog(List.of(entry));
                    });
        });
    }

    public Mono<ExportRequest> approveExportRequest(String requestId, String approverId, DeliveryMethod method) {
        if (isBlank(approverId) || method == null) {
            return Mono.error(new ValidationException("Approval requires an approver and a delivery method"));
        }
        return findRequest(requestId)
                .flatMap(request -> transition(request, request.approved(approverId, method, clock.instant())))
                .flatMap(approved -> record(approved, approverId, AccessAction.EXPORT_APPROVED,
                                "delivery via " + method)
                        .doOnNext(entry -> events.publish(new VaultEvent.ExportApproved(clock.instant(),
                                approved.id(), approved.vaultId(), approverId, method.name())))
                        .then(getExportRequest(requestId)));
    }

    public Mono<ExportRequest> rejectExportRequest(String requestId, String rejecterId, String reason) {
        if (isBlank(rejecterId) || isBlank(reason)) {
            return Mono.error(new ValidationException("Rejection requires a rejecter and a reason"));
        }
        return findRequest(requestId)
                .flatMap(request -> transition(request, request.rejected(rejecterId, reason, clock.instant())))
                .flatMap(rejected -> record(rejected, rejecterId, AccessAction.EXPORT_REJECTED, reason)
                        .doOnNext(entry -> events.publish(new VaultEvent.ExportRejected(clock.instant(),
                                rejected.id(), rejected.vaultId(), rejecterId, reason)))
                        .then(getExportRequest(requestId)));
    }

    /**
     * Unseals every item of the vault and hands them over. Items failing
     * verification are withheld, logged and reported; the rest are still
     * delivered. A request is delivered at most once.
     */
    public Mono<ExportPackage> deliverExport(String requestId, String accessorId) {
        if (isBlank(accessorId)) {
            return Mono.error(new ValidationException("Delivery requires an accessor id"));
        }
        return findRequest(requestId).flatMap(request -> {
            if (request.status() != ExportStatus.APPROVED) {
                return Mono.error(new PermissionDeniedException(
                        "Export request " + requestId + " is " + request.status() + ", not APPROVED"));
            }
            return requireVault(request.vaultId())
                    .flatMap(vault -> unsealAll(vault, request, accessorId)
                            .flatMap(outcome -> commitDelivery(vault, request, accessorId, outcome)));
        });
    }

    public Mono<ExportRequest> getExportRequest(String requestId) {
        return findRequest(requestId)
                .flatMap(request -> requests.findAccessLog(requestId).collectList()
                        .map(request::withAccessLog));
    }

    public Flux<ExportRequest> listExportRequests(String vaultId) {
        return requests.findByVaultId(vaultId);
    }

    private Mono<Unsealed> unsealAll(VaultRecord vault, ExportRequest request, String accessorId) {
        List<DeliveredItem> delivered = new ArrayList<>();
        List<WithheldItem> withheld = new ArrayList<>();
        return vaults.findEvidence(vault.id())
                .concatMap(item -> sealingService.unseal(item)
                        .doOnNext(plaintext -> delivered.add(new DeliveredItem(item.id(), item.kind(),
                                item.conversationId(), item.messageId(), item.checksum(), item.capturedAt(),
                                plaintext)))
                        .then()
                        .onErrorResume(IntegrityException.class,
                                e -> withhold(vault, request, accessorId, item, e)
                                        .doOnNext(withheld::add)
                                        .then()))
                .then(Mono.fromSupplier(() -> new Unsealed(delivered, withheld)));
    }

    private Mono<WithheldItem> withhold(VaultRecord vault, ExportRequest request, String accessorId,
                                        SealedEvidenceItem item, IntegrityException failure) {
        logger.error("SECURITY evidence {} in vault {} withheld from export {}: {}",
                item.id(), vault.id(), request.id(), failure.getMessage());
        events.publish(new VaultEvent.IntegrityViolation(clock.instant(), vault.id(), item.id(),
                failure.getMessage()));
        return custodyLog.append(vault.id(), accessorId, AccessAction.INTEGRITY_FAILURE, request.legalBasis(),
                        "evidence " + item.id() + ": " + failure.getMessage())
                .thenReturn(new WithheldItem(item.id(), failure.getMessage()));
    }

    private Mono<ExportPackage> commitDelivery(VaultRecord vault, ExportRequest request, String accessorId,
                                               Unsealed outcome) {
        String detail = "delivered " + outcome.delivered().size() + " item(s), withheld "
                + outcome.withheld().size();
        AccessLogEntry entry = custodyLog.entry(vault.id(), accessorId, AccessAction.EXPORT_DELIVERED,
                request.legalBasis(), detail);
        ExportRequest delivered = request.delivered(entry.timestamp());

        // only the delivery that wins the status change is recorded as a delivery
        return requests.compareAndSetStatus(ExportStatus.APPROVED, delivered)
                .flatMap(applied -> {
                    if (!applied) {
                        logger.warn("Export {} from vault {} refused to {}: already delivered",
                                request.id(), vault.id(), accessorId);
                        return Mono.error(new PermissionDeniedException(
                                "Export request " + request.id() + " was delivered concurrently"));
                    }
                    return vaults.appendAccessLog(vault.id(), entry)
                            .then(requests.appendAccessLog(request.id(), entry))
                            .then(vaults.appendExportSummary(vault.id(), summary(delivered, accessorId)))
                            .thenReturn(delivered);
                })
                .map(done -> {
                    logger.info("Export {} delivered from vault {}: {}", request.id(), vault.id(), detail);
                    events.publish(new VaultEvent.ExportDelivered(entry.timestamp(), request.id(), vault.id(),
                            accessorId, outcome.delivered().size(), outcome.withheld().size()));
                    return new ExportPackage(
                            request.id(),
                            vault.id(),
                            vault.caseId(),
                            vault.category(),
                            vault.severity(),
                            outcome.delivered().size() + outcome.withheld().size(),
                            outcome.delivered(),
                            outcome.withheld(),
                            outcome.withheld().isEmpty(),
                            accessorId,
                            request.legalBasis(),
                            entry.signature(),
                            request.deliveryMethod(),
                            request.recipient(),
                            entry.timestamp());
                });
    }

    private Mono<ExportRequest> transition(ExportRequest current, ExportRequest next) {
        if (!current.status().canTransitionTo(next.status())) {
            return Mono.error(illegal(current, next.status()));
        }
        return requests.compareAndSetStatus(current.status(), next)
                .flatMap(applied -> applied
                        ? Mono.just(next)
                        : findRequest(current.id())
                                .flatMap(latest -> Mono.<ExportRequest>error(illegal(latest, next.status()))));
    }

    /** Writes the same signed entry to the request and the vault, plus a vault-side summary. */
    private Mono<AccessLogEntry> record(ExportRequest request, String actorId, AccessAction action, String detail) {
        AccessLogEntry entry = custodyLog.entry(request.vaultId(), actorId, action, request.legalBasis(), detail);
        return requests.appendAccessLog(request.id(), entry)
                .then(vaults.appendAccessLog(request.vaultId(), entry))
                .then(vaults.appendExportSummary(request.vaultId(), summary(request, actorId)))
                .thenReturn(entry);
    }

    private static ExportSummary summary(ExportRequest request, String actorId) {
        return new ExportSummary(request.id(), request.type().name(), request.status().name(), actorId,
                request.updatedAt());
    }

    private static IllegalTransitionException illegal(ExportRequest request, ExportStatus target) {
        return new IllegalTransitionException(
                "Export request " + request.id() + " cannot move from " + request.status() + " to " + target);
    }

    private Mono<ExportRequest> findRequest(String requestId) {
        return requests.findById(requestId)
                .switchIfEmpty(Mono.error(new NotFoundException("Export request", requestId)));
    }

    private Mono<VaultRecord> requireVault(String vaultId) {
        return vaults.findById(vaultId)
                .switchIfEmpty(Mono.error(new NotFoundException("Vault", vaultId)));
    }

    private static void validate(String requesterId, ExportRequestType type, SupportingReference reference,
                                 String recipient) {
        if (isBlank(requesterId)) {
            throw new ValidationException("Export request requires a requester id");
        }
        if (type == null) {
            throw new ValidationException("Export request requires a request type");
        }
        if (isBlank(recipient)) {
            throw new ValidationException("Export request requires a recipient");
        }
        SupportingReference ref = reference == null ? SupportingReference.none() : reference;
        switch (type) {
            case COURT_SUBPOENA -> {
                if (isBlank(ref.courtOrderId())) {
                    throw new ValidationException("A court subpoena requires a court order id");
                }
            }
            case LAW_ENFORCEMENT_ORDER -> {
                if (isBlank(ref.agencyId())) {
                    throw new ValidationException("A law enforcement order requires the issuing agency id");
                }
            }
            case USER_DATA_REQUEST -> {
                // no supporting reference needed
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Unsealed(List<DeliveredItem> delivered, List<WithheldItem> withheld) {}
}
