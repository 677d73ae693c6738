package io.vfslite.core;

/**
 * Raised when a filename is already registered or the active version is already a snapshot.
 */
public final class ConflictException extends VfsException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
