package com.evidencevault.crypto.cassandra;

import java.nio.ByteBuffer;
import java.time.Instant;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * Sealing key material. Rows are insert-only; rotation adds a row and moves the
 * pointer in {@code vault_key_state}.
 */
@Table("vault_keys")
public class VaultKeyEntity {

    @PrimaryKey("key_id")
    private String keyId;

    @Column("material")
    private ByteBuffer material;

    @Column("created_at")
    private Instant createdAt;

    public VaultKeyEntity() {}

    public String getKeyId() { return keyId; }
    public void setKeyId(String keyId) { this.keyId = keyId; }
    public ByteBuffer getMaterial() { return material; }
    public void setMaterial(ByteBuffer material) { this.material = material; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
