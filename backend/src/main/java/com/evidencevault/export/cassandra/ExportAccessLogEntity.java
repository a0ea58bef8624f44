package com.evidencevault.export.cassandra;

import java.time.Instant;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("export_access_log")
public class ExportAccessLogEntity {

    @PrimaryKey
    private ExportAccessLogKey key;

    @Column("vault_id")
    private String vaultId;

    @Column("accessor_id")
    private String accessorId;

    @Column("action")
    private String action;

    @Column("accessed_at")
    private Instant accessedAt;

    @Column("signature")
    private String signature;

    @Column("legal_basis")
    private String legalBasis;

    @Column("detail")
    private String detail;

    public ExportAccessLogEntity() {}

    public ExportAccessLogKey getKey() { return key; }
    public void setKey(ExportAccessLogKey key) { this.key = key; }
    public String getVaultId() { return vaultId; }
    public void setVaultId(String vaultId) { this.vaultId = vaultId; }
    public String getAccessorId() { return accessorId; }
    public void setAccessorId(String accessorId) { this.accessorId = accessorId; }
    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }
    public Instant getAccessedAt() { return accessedAt; }
    public void setAccessedAt(Instant accessedAt) { this.accessedAt = accessedAt; }
    public String getSignature() { return signature; }
    public void setSignature(String signature) { this.signature = signature; }
    public String getLegalBasis() { return legalBasis; }
    public void setLegalBasis(String legalBasis) { this.legalBasis = legalBasis; }
    public String getDetail() { return detail; }
    public void setDetail(String detail) { this.detail = detail; }
}
