package com.evidencevault.retention.cassandra;

import java.time.Instant;
import java.util.Set;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("legal_holds")
public class LegalHoldEntity {

    @PrimaryKey("case_id")
    private String caseId;

    @Column("reason")
    private String reason;

    @Column("scope_type")
    private String scopeType;

    /** Only set for USER scope. */
    @Column("scope_user_id")
    private String scopeUserId;

    @Column("vault_ids")
    private Set<String> vaultIds;

    @Column("counsel")
    private String counsel;

    @Column("justification")
    private String justification;

    @Column("active")
    private boolean active;

    @Column("created_by")
    private String createdBy;

    @Column("created_at")
    private Instant createdAt;

    @Column("closed_by")
    private String closedBy;

    @Column("closed_at")
    private Instant closedAt;

    public LegalHoldEntity() {}

    public String getCaseId() { return caseId; }
    public void setCaseId(String caseId) { this.caseId = caseId; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public String getScopeType() { return scopeType; }
    public void setScopeType(String scopeType) { this.scopeType = scopeType; }
    public String getScopeUserId() { return scopeUserId; }
    public void setScopeUserId(String scopeUserId) { this.scopeUserId = scopeUserId; }
    public Set<String> getVaultIds() { return vaultIds; }
    public void setVaultIds(Set<String> vaultIds) { this.vaultIds = vaultIds; }
    public String getCounsel() { return counsel; }
    public void setCounsel(String counsel) { this.counsel = counsel; }
    public String getJustification() { return justification; }
    public void setJustification(String justification) { this.justification = justification; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public String getClosedBy() { return closedBy; }
    public void setClosedBy(String closedBy) { this.closedBy = closedBy; }
    public Instant getClosedAt() { return closedAt; }
    public void setClosedAt(Instant closedAt) { this.closedAt = closedAt; }
}
