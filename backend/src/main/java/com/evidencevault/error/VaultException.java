package com.evidencevault.error;

/**
 * Root of the vault error taxonomy. Every failure a caller can act on is one of
 * the subclasses; anything else escaping a service is an infrastructure fault.
 */
public abstract class VaultException extends RuntimeException {

    protected VaultException(String message) {
        super(message);
    }

    protected VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
