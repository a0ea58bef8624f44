package com.evidencevault.error;

/** Caller-correctable input problem. Raised before any state is written. */
public class ValidationException extends VaultException {

    public ValidationException(String message) {
        super(message);
    }
}
