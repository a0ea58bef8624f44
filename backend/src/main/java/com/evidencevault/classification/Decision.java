package com.evidencevault.classification;

/**
 * Verdict of one classification. {@link #NO_VIOLATION} means nothing matched
 * and nothing is stored; it is kept apart from {@link #PROTECT_PRIVACY}, which
 * additionally forbids the content from reaching any detector or store.
 */
public enum Decision {
    STORE_EVIDENCE,
    PROTECT_PRIVACY,
    REQUIRES_REVIEW,
    NO_VIOLATION
}
