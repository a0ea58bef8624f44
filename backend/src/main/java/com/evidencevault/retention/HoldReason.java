package com.evidencevault.retention;

public enum HoldReason {
    REGULATOR_REQUEST,
    COURT_ORDER,
    FRAUD_INVESTIGATION
}
