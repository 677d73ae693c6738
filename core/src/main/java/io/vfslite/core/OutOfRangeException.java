package io.vfslite.core;

/**
 * Raised for a version id outside [0, totalVersions) or a top-k request larger than the index.
 */
public final class OutOfRangeException extends VfsException {

    public OutOfRangeException(String message) {
        super(ErrorKind.RANGE, message);
    }
}
