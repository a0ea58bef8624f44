package com.evidencevault.vault;

import java.time.Instant;
import java.util.List;

/**
 * One encrypted evidence record. Immutable after creation and owned by exactly
 * one vault; there is no update or delete for a single item.
 *
 * <p>{@code checksum} is the hex SHA-256 of the plaintext taken before
 * encryption. It is deliberately independent of the AEAD tag so it survives
 * key rotation and re-encryption.
 */
public record SealedEvidenceItem(
        String id,
        EvidenceKind kind,
        byte[] ciphertext,
        byte[] iv,
        byte[] authTag,
        String keyId,
        String checksum,
        String conversationId,
        String messageId,
        String capturedBy,
        double relevanceScore,
        List<String> legalReferences,
        Instant capturedAt
) {

    public SealedEvidenceItem {
        legalReferences = legalReferences == null ? List.of() : List.copyOf(legalReferences);
    }

    @Override
    public String toString() {
        return "SealedEvidenceItem[id=" + id + ", kind=" + kind + ", keyId=" + keyId
                + ", messageId=" + messageId + ", capturedAt=" + capturedAt + "]";
    }
}
