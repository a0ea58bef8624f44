package com.evidencevault.classification;

import java.util.Set;

/**
 * Facts about a message that are not in its text.
 *
 * @param senderStatedAge   profile age of the sender when known, otherwise null
 * @param recipientStatedAge profile age of the recipient when known, otherwise null
 * @param consentWithdrawn  a stop or block signal was recorded in this conversation
 *                          before the message was sent
 */
public record ClassificationContext(
        String senderId,
        String recipientId,
        String conversationId,
        String messageId,
        Integer senderStatedAge,
        Integer recipientStatedAge,
        boolean consentWithdrawn,
        Set<String> jurisdictions
) {

    public ClassificationContext {
        jurisdictions = jurisdictions == null ? Set.of() : Set.copyOf(jurisdictions);
    }

    public static ClassificationContext directMessage(String senderId, String recipientId,
                                                      String conversationId, String messageId) {
        return new ClassificationContext(senderId, recipientId, conversationId, messageId,
                null, null, false, Set.of());
    }

    public ClassificationContext withConsentWithdrawn() {
        return new ClassificationContext(senderId, recipientId, conversationId, messageId,
                senderStatedAge, recipientStatedAge, true, jurisdictions);
    }

    public ClassificationContext withStatedAges(Integer senderAge, Integer recipientAge) {
        return new ClassificationContext(senderId, recipientId, conversationId, messageId,
                senderAge, recipientAge, consentWithdrawn, jurisdictions);
    }

    public ClassificationContext withJurisdictions(Set<String> codes) {
        return new ClassificationContext(senderId, recipientId, conversationId, messageId,
                senderStatedAge, recipientStatedAge, consentWithdrawn, codes);
    }

    boolean involvesStatedMinor() {
        return (senderStatedAge != null && senderStatedAge < 18)
                || (recipientStatedAge != null && recipientStatedAge < 18);
    }
}
