package com.evidencevault.export.cassandra;

import java.util.List;
import java.util.UUID;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.cql.ReactiveCqlOperations;
import org.springframework.stereotype.Component;

import com.evidencevault.export.DeliveryMethod;
import com.evidencevault.export.ExportRequest;
import com.evidencevault.export.ExportRequestStore;
import com.evidencevault.export.ExportRequestType;
import com.evidencevault.export.ExportStatus;
import com.evidencevault.export.SupportingReference;
import com.evidencevault.vault.AccessAction;
import com.evidencevault.vault.AccessLogEntry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Component
@ConditionalOnProperty(prefix = "vault.store", name = "type", havingValue = "cassandra", matchIfMissing = true)
public class CassandraExportRequestStore implements ExportRequestStore {

    private static final String INSERT_REQUEST =
            "INSERT INTO export_requests (id, vault_id, request_type, requester_id, court_order_id, agency_id, "
                    + "badge_number, recipient, status, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) IF NOT EXISTS";
    private static final String SET_STATUS =
            "UPDATE export_requests SET status = ?, approver_id = ?, rejecter_id = ?, rejection_reason = ?, "
                    + "delivery_method = ?, updated_at = ? WHERE id = ? IF status = ?";

    private final ExportRequestRepository requests;
    private final ExportAccessLogRepository accessLog;
    private final ReactiveCqlOperations cql;

    public CassandraExportRequestStore(ExportRequestRepository requests,
                                       ExportAccessLogRepository accessLog,
                                       ReactiveCassandraOperations operations) {
        this.requests = requests;
        this.accessLog = accessLog;
        this.cql = operations.getReactiveCqlOperations();
    }

    @Override
    public Mono<Void> insert(ExportRequest r) {
        SupportingReference ref = r.supportingReference();
        return cql.execute(INSERT_REQUEST, r.id(), r.vaultId(), r.type().name(), r.requesterId(),
                        ref.courtOrderId(), ref.agencyId(), ref.badgeNumber(), r.recipient(),
                        r.status().name(), r.createdAt(), r.updatedAt())
                .then();
    }

    @Override
    public Mono<ExportRequest> findById(String requestId) {
        return requests.findById(requestId).map(CassandraExportRequestStore::toRequest);
    }

    @Override
    public Flux<ExportRequest> findByVaultId(String vaultId) {
        return requests.findAllByVaultId(vaultId).map(CassandraExportRequestStore::toRequest);
    }

    @Override
    public Mono<Boolean> compareAndSetStatus(ExportStatus expected, ExportRequest next) {
        return cql.execute(SET_STATUS,
                next.status().name(),
                next.approverId(),
                next.rejecterId(),
                next.rejectionReason(),
                next.deliveryMethod() == null ? null : next.deliveryMethod().name(),
                next.updatedAt(),
                next.id(),
                expected.name());
    }

    @Override
    public Mono<Void> appendAccessLog(String requestId, AccessLogEntry entry) {
        ExportAccessLogEntity entity = new ExportAccessLogEntity();
        entity.setKey(new ExportAccessLogKey(requestId, UUID.fromString(entry.entryId())));
        entity.setVaultId(entry.vaultId());
        entity.setAccessorId(entry.accessorId());
        entity.setAction(entry.action().name());
        entity.setAccessedAt(entry.timestamp());
        entity.setSignature(entry.signature());
        entity.setLegalBasis(entry.legalBasis());
        entity.setDetail(entry.detail());
        return accessLog.save(entity).then();
    }

    @Override
    public Flux<AccessLogEntry> findAccessLog(String requestId) {
        return accessLog.findAllByKeyRequestId(requestId)
                .map(e -> new AccessLogEntry(
                        e.getKey().entryId().toString(),
                        e.getVaultId(),
                        e.getAccessorId(),
                        AccessAction.valueOf(e.getAction()),
                        e.getAccessedAt(),
                        e.getSignature(),
                        e.getLegalBasis(),
                        e.getDetail()));
    }

    private static ExportRequest toRequest(ExportRequestEntity e) {
        return new ExportRequest(
                e.getId(),
                e.getVaultId(),
                ExportRequestType.valueOf(e.getRequestType()),
                e.getRequesterId(),
                new SupportingReference(e.getCourtOrderId(), e.getAgencyId(), e.getBadgeNumber()),
                e.getRecipient(),
                ExportStatus.valueOf(e.getStatus()),
                e.getApproverId(),
                e.getRejecterId(),
                e.getRejectionReason(),
                e.getDeliveryMethod() == null ? null : DeliveryMethod.valueOf(e.getDeliveryMethod()),
                e.getCreatedAt(),
                e.getUpdatedAt(),
                List.of());
    }
}
