package com.evidencevault.vault;

import java.util.List;

/**
 * Cleartext facts recorded next to a sealed payload.
 *
 * @param conversationId source locator: conversation the content came from
 * @param messageId      source locator: message (or media) id
 * @param capturedBy     actor that captured the content (user or system id)
 * @param relevanceScore classification confidence at capture time
 */
public record EvidenceMetadata(
        EvidenceKind kind,
        String conversationId,
        String messageId,
        String capturedBy,
        double relevanceScore,
        List<String> legalReferences
) {

    public EvidenceMetadata {
        legalReferences = legalReferences == null ? List.of() : List.copyOf(legalReferences);
    }
}
