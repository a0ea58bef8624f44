package com.evidencevault.export;

public enum ExportRequestType {
    /** Requires a court-order identifier. */
    COURT_SUBPOENA,
    /** Requires the issuing agency. */
    LAW_ENFORCEMENT_ORDER,
    /** A party to the case asking for their own data. */
    USER_DATA_REQUEST
}
