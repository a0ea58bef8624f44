package com.evidencevault.classification;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
