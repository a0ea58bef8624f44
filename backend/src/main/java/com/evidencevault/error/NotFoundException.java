package com.evidencevault.error;

public class NotFoundException extends VaultException {

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
