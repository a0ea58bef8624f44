package com.evidencevault.classification;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One category detector. Detectors are evaluated independently, in
 * {@link ViolationCategory} order, and never scored against each other.
 */
interface ViolationDetector {

    double CONFIDENCE_STEP = 0.1;
    double CONFIDENCE_CAP = 0.99;

    ViolationCategory category();

    /** Number of independent indicators found; zero means the detector did not fire. */
    int indicators(String normalized, ClassificationContext context, PrivacySignals signals);

    double baseConfidence();

    /** A hit from a review-only detector is never stored, whatever its confidence. */
    default boolean reviewOnly() {
        return false;
    }

    default Optional<Hit> evaluate(String normalized, ClassificationContext context, PrivacySignals signals) {
        int found = indicators(normalized, context, signals);
        if (found == 0) {
            return Optional.empty();
        }
        double confidence = Math.min(CONFIDENCE_CAP, baseConfidence() + CONFIDENCE_STEP * (found - 1));
        return Optional.of(new Hit(category(), found, confidence, reviewOnly()));
    }

    record Hit(ViolationCategory category, int indicators, double confidence, boolean reviewOnly) {}

    static ViolationDetector ofPatterns(ViolationCategory category, double baseConfidence, String... regexes) {
        List<Pattern> patterns = PrivacySignals.patterns(regexes);
        return new ViolationDetector() {
            @Override
            public ViolationCategory category() {
                return category;
            }

            @Override
            public int indicators(String normalized, ClassificationContext context, PrivacySignals signals) {
                return PrivacySignals.count(patterns, normalized);
            }

            @Override
            public double baseConfidence() {
                return baseConfidence;
            }
        };
    }
}
