package com.evidencevault.vault;

public enum EvidenceKind {
    MESSAGE,
    MEDIA,
    METADATA
}
