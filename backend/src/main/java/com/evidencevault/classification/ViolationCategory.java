package com.evidencevault.classification;

/**
 * Violation categories in detection priority order. The declaration order is
 * the order detectors run in; the first one to fire decides the category.
 */
public enum ViolationCategory {
    CHILD_EXPLOITATION(Severity.CRITICAL),
    VIOLENCE_THREATS(Severity.HIGH),
    HARASSMENT_HATE(Severity.MEDIUM),
    BLACKMAIL_EXTORTION(Severity.HIGH),
    FRAUD_FINANCIAL_CRIME(Severity.HIGH),
    IP_THEFT(Severity.MEDIUM),
    REFUND_ABUSE(Severity.LOW),
    SEXUAL_SERVICES_PRICING(Severity.HIGH),
    NSFW_FUNNELING(Severity.MEDIUM),
    CONSENT_WITHDRAWAL_IGNORED(Severity.HIGH);

    private final Severity baseSeverity;

    ViolationCategory(Severity baseSeverity) {
        this.baseSeverity = baseSeverity;
    }

    public Severity baseSeverity() {
        return baseSeverity;
    }
}
