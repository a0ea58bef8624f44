package com.evidencevault.error;

/** A state change was requested from a state that does not allow it. */
public class IllegalTransitionException extends VaultException {

    public IllegalTransitionException(String message) {
        super(message);
    }
}
