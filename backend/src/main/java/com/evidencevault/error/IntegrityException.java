package com.evidencevault.error;

/**
 * Sealed evidence failed authentication or checksum verification.
 * Always fatal for the affected item; no plaintext accompanies it.
 */
public class IntegrityException extends VaultException {

    private final String evidenceId;

    public IntegrityException(String evidenceId, String message) {
        super(message);
        this.evidenceId = evidenceId;
    }

    public IntegrityException(String evidenceId, String message, Throwable cause) {
        super(message, cause);
        this.evidenceId = evidenceId;
    }

    public String getEvidenceId() {
        return evidenceId;
    }
}
