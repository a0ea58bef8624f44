package com.evidencevault.classification;

import java.util.List;

/**
 * Per-item verdict. Ephemeral: it travels with the content into the sealing
 * step but is never persisted as-is.
 *
 * <p>category and severity are null for {@link Decision#PROTECT_PRIVACY} and
 * {@link Decision#NO_VIOLATION}.
 */
public record ClassificationResult(
        Decision decision,
        ViolationCategory category,
        Severity severity,
        List<String> triggeredLegalReferences,
        double confidence
) {

    static final double PROTECTION_CONFIDENCE = 0.9;
    static final double NO_VIOLATION_CONFIDENCE = 0.95;

    public ClassificationResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        triggeredLegalReferences = triggeredLegalReferences == null
                ? List.of()
                : List.copyOf(triggeredLegalReferences);
    }

    static ClassificationResult protectPrivacy() {
        return new ClassificationResult(Decision.PROTECT_PRIVACY, null, null, List.of(), PROTECTION_CONFIDENCE);
    }

    static ClassificationResult noViolation() {
        return new ClassificationResult(Decision.NO_VIOLATION, null, null, List.of(), NO_VIOLATION_CONFIDENCE);
    }

    public boolean shouldStore() {
        return decision == Decision.STORE_EVIDENCE;
    }
}
