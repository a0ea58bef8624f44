package com.evidencevault.vault.cassandra;

import java.time.Instant;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("vault_exports")
public class ExportSummaryEntity {

    @PrimaryKey
    private VaultChildKey key;

    @Column("request_id")
    private String requestId;

    @Column("request_type")
    private String requestType;

    @Column("status")
    private String status;

    @Column("actor_id")
    private String actorId;

    @Column("recorded_at")
    private Instant recordedAt;

    public ExportSummaryEntity() {}

    public VaultChildKey getKey() { return key; }
    public void setKey(VaultChildKey key) { this.key = key; }
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }
    public String getRequestType() { return requestType; }
    public void setRequestType(String requestType) { this.requestType = requestType; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getActorId() { return actorId; }
    public void setActorId(String actorId) { this.actorId = actorId; }
    public Instant getRecordedAt() { return recordedAt; }
    public void setRecordedAt(Instant recordedAt) { this.recordedAt = recordedAt; }
}
