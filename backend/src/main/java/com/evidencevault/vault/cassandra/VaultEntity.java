package com.evidencevault.vault.cassandra;

import java.time.Instant;
import java.util.Set;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * Scalar vault row. Written only through conditional CQL in
 * {@link CassandraVaultStore}; the repository is used for reads.
 */
@Table("vaults")
public class VaultEntity {

    @PrimaryKey
    private String id;

    @Column("case_id")
    private String caseId;

    @Column("reporter_id")
    private String reporterId;

    @Column("subject_id")
    private String subjectId;

    @Column("category")
    private String category;

    @Column("severity")
    private String severity;

    @Column("jurisdictions")
    private Set<String> jurisdictions;

    @Column("created_at")
    private Instant createdAt;

    @Column("retention_deadline")
    private Instant retentionDeadline;

    @Column("hard_delete_deadline")
    private Instant hardDeleteDeadline;

    /** Case ids of the holds protecting this vault. Kept in step with hold_count by CAS. */
    @Column("held_by")
    private Set<String> heldBy;

    @Column("hold_count")
    private int holdCount;

    @Column("purging")
    private boolean purging;

    public VaultEntity() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getCaseId() { return caseId; }
    public void setCaseId(String caseId) { this.caseId = caseId; }
    public String getReporterId() { return reporterId; }
    public void setReporterId(String reporterId) { this.reporterId = reporterId; }
    public String getSubjectId() { return subjectId; }
    public void setSubjectId(String subjectId) { this.subjectId = subjectId; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getSeverity() { return severity; }
    public void setSeverity(String severity) { this.severity = severity; }
    public Set<String> getJurisdictions() { return jurisdictions; }
    public void setJurisdictions(Set<String> jurisdictions) { this.jurisdictions = jurisdictions; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getRetentionDeadline() { return retentionDeadline; }
    public void setRetentionDeadline(Instant retentionDeadline) { this.retentionDeadline = retentionDeadline; }
    public Instant getHardDeleteDeadline() { return hardDeleteDeadline; }
    public void setHardDeleteDeadline(Instant hardDeleteDeadline) { this.hardDeleteDeadline = hardDeleteDeadline; }
    public Set<String> getHeldBy() { return heldBy; }
    public void setHeldBy(Set<String> heldBy) { this.heldBy = heldBy; }
    public int getHoldCount() { return holdCount; }
    public void setHoldCount(int holdCount) { this.holdCount = holdCount; }
    public boolean isPurging() { return purging; }
    public void setPurging(boolean purging) { this.purging = purging; }
}
