package io.vfslite.core;

/**
 * Raised when a filename is not registered.
 */
public final class NotFoundException extends VfsException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
