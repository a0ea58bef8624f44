package com.evidencevault.vault.cassandra;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.List;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("evidence_items")
public class EvidenceItemEntity {

    @PrimaryKey
    private VaultChildKey key;

    @Column("kind")
    private String kind;

    @Column("ciphertext")
    private ByteBuffer ciphertext;

    @Column("iv")
    private ByteBuffer iv;

    @Column("auth_tag")
    private ByteBuffer authTag;

    @Column("key_id")
    private String keyId;

    /** Hex SHA-256 of the plaintext, taken before encryption. */
    @Column("checksum")
    private String checksum;

    @Column("conversation_id")
    private String conversationId;

    @Column("message_id")
    private String messageId;

    @Column("captured_by")
    private String capturedBy;

    @Column("relevance_score")
    private double relevanceScore;

    @Column("legal_references")
    private List<String> legalReferences;

    @Column("captured_at")
    private Instant capturedAt;

    public EvidenceItemEntity() {}

    public VaultChildKey getKey() { return key; }
    public void setKey(VaultChildKey key) { this.key = key; }
    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }
    public ByteBuffer getCiphertext() { return ciphertext; }
    public void setCiphertext(ByteBuffer ciphertext) { this.ciphertext = ciphertext; }
    public ByteBuffer getIv() { return iv; }
    public void setIv(ByteBuffer iv) { this.iv = iv; }
    public ByteBuffer getAuthTag() { return authTag; }
    public void setAuthTag(ByteBuffer authTag) { this.authTag = authTag; }
    public String getKeyId() { return keyId; }
    public void setKeyId(String keyId) { this.keyId = keyId; }
    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }
    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }
    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }
    public String getCapturedBy() { return capturedBy; }
    public void setCapturedBy(String capturedBy) { this.capturedBy = capturedBy; }
    public double getRelevanceScore() { return relevanceScore; }
    public void setRelevanceScore(double relevanceScore) { this.relevanceScore = relevanceScore; }
    public List<String> getLegalReferences() { return legalReferences; }
    public void setLegalReferences(List<String> legalReferences) { this.legalReferences = legalReferences; }
    public Instant getCapturedAt() { return capturedAt; }
    public void setCapturedAt(Instant capturedAt) { this.capturedAt = capturedAt; }
}
