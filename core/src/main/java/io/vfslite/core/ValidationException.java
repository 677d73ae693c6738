package io.vfslite.core;

/**
 * Invalid input: empty filename, bad number or wrong argument count.
 */
public final class ValidationException extends VfsException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
