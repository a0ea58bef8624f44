package com.evidencevault.vault.cassandra;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/** Case id to vault id. The row that makes vault creation unique per case. */
@Table("vault_cases")
public class VaultCaseEntity {

    @PrimaryKey("case_id")
    private String caseId;

    @Column("vault_id")
    private String vaultId;

    public VaultCaseEntity() {}

    public String getCaseId() { return caseId; }
    public void setCaseId(String caseId) { this.caseId = caseId; }
    public String getVaultId() { return vaultId; }
    public void setVaultId(String vaultId) { this.vaultId = vaultId; }
}
