package com.evidencevault.error;

public class PermissionDeniedException extends VaultException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
