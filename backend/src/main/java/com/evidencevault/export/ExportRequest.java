package com.evidencevault.export;

import java.time.Instant;
import java.util.List;

import com.evidencevault.vault.AccessLogEntry;

/**
 * A request to release a vault's evidence. Stored apart from the vault; the
 * vault only keeps {@link com.evidencevault.vault.ExportSummary} traces.
 *
 * @param accessLog entries recorded against this request, oldest first. Empty on
 *                  the stored row; filled in on reads.
 */
public record ExportRequest(
        String id,
        String vaultId,
        ExportRequestType type,
        String requesterId,
        SupportingReference supportingReference,
        String recipient,
        ExportStatus status,
        String approverId,
        String rejecterId,
        String rejectionReason,
        DeliveryMethod deliveryMethod,
        Instant createdAt,
        Instant updatedAt,
        List<AccessLogEntry> accessLog
) {

    public ExportRequest {
        supportingReference = supportingReference == null ? SupportingReference.none() : supportingReference;
        accessLog = accessLog == null ? List.of() : List.copyOf(accessLog);
    }

    /** Authority recorded on every access made under this request. */
    public String legalBasis() {
        return switch (type) {
            case COURT_SUBPOENA -> type + ":" + supportingReference.courtOrderId();
            case LAW_ENFORCEMENT_ORDER -> supportingReference.badgeNumber() == null
                    ? type + ":" + supportingReference.agencyId()
                    : type + ":" + supportingReference.agencyId() + "/" + supportingReference.badgeNumber();
            case USER_DATA_REQUEST -> type.name();
        };
    }

    ExportRequest approved(String approver, DeliveryMethod method, Instant at) {
        return new ExportRequest(id, vaultId, type, requesterId, supportingReference, recipient,
                ExportStatus.APPROVED, approver, null, null, method, createdAt, at, List.of());
    }

    ExportRequest rejected(String rejecter, String reason, Instant at) {
        return new ExportRequest(id, vaultId, type, requesterId, supportingReference, recipient,
                ExportStatus.REJECTED, null, rejecter, reason, null, createdAt, at, List.of());
    }

    ExportRequest delivered(Instant at) {
        return new ExportRequest(id, vaultId, type, requesterId, supportingReference, recipient,
                ExportStatus.DELIVERED, approverId, null, null, deliveryMethod, createdAt, at, List.of());
    }

    ExportRequest withAccessLog(List<AccessLogEntry> entries) {
        return new ExportRequest(id, vaultId, type, requesterId, supportingReference, recipient,
                status, approverId, rejecterId, rejectionReason, deliveryMethod, createdAt, updatedAt, entries);
    }
}
