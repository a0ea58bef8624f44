package com.evidencevault.export.cassandra;

import java.time.Instant;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * Export request row. Status changes go through
 * {@code UPDATE ... IF status = ?} in {@link CassandraExportRequestStore}.
 */
@Table("export_requests")
public class ExportRequestEntity {

    @PrimaryKey
    private String id;

    @Column("vault_id")
    private String vaultId;

    @Column("request_type")
    private String requestType;

    @Column("requester_id")
    private String requesterId;

    @Column("court_order_id")
    private String courtOrderId;

    @Column("agency_id")
    private String agencyId;

    @Column("badge_number")
    private String badgeNumber;

    @Column("recipient")
    private String recipient;

    @Column("status")
    private String status;

    @Column("approver_id")
    private String approverId;

    @Column("rejecter_id")
    private String rejecterId;

    @Column("rejection_reason")
    private String rejectionReason;

    @Column("delivery_method")
    private String deliveryMethod;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    public ExportRequestEntity() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getVaultId() { return vaultId; }
    public void setVaultId(String vaultId) { this.vaultId = vaultId; }
    public String getRequestType() { return requestType; }
    public void setRequestType(String requestType) { this.requestType = requestType; }
    public String getRequesterId() { return requesterId; }
    public void setRequesterId(String requesterId) { this.requesterId = requesterId; }
    public String getCourtOrderId() { return courtOrderId; }
    public void setCourtOrderId(String courtOrderId) { this.courtOrderId = courtOrderId; }
    public String getAgencyId() { return agencyId; }
    public void setAgencyId(String agencyId) { this.agencyId = agencyId; }
    public String getBadgeNumber() { return badgeNumber; }
    public void setBadgeNumber(String badgeNumber) { this.badgeNumber = badgeNumber; }
    public String getRecipient() { return recipient; }
    public void setRecipient(String recipient) { this.recipient = recipient; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getApproverId() { return approverId; }
    public void setApproverId(String approverId) { this.approverId = approverId; }
    public String getRejecterId() { return rejecterId; }
    public void setRejecterId(String rejecterId) { this.rejecterId = rejecterId; }
    public String getRejectionReason() { return rejectionReason; }
    public void setRejectionReason(String rejectionReason) { this.rejectionReason = rejectionReason; }
    public String getDeliveryMethod() { return deliveryMethod; }
    public void setDeliveryMethod(String deliveryMethod) { this.deliveryMethod = deliveryMethod; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
