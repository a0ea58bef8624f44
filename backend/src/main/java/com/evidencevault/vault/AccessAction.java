package com.evidencevault.vault;

public enum AccessAction {
    EVIDENCE_SEALED,
    METADATA_VIEWED,
    EXPORT_REQUESTED,
    EXPORT_APPROVED,
    EXPORT_REJECTED,
    EXPORT_DELIVERED,
    INTEGRITY_FAILURE
}
