package io.vfslite.core;

/**
 * Raised when the active version is the root and there is no parent to roll back to.
 */
public final class StateException extends VfsException {

    public StateException(String message) {
        super(ErrorKind.STATE, message);
    }
}
