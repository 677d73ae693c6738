package io.vfslite.core;

/**
 * Category of a {@link VfsException}.
 * <p>
 * Callers that render errors (text or JSON) switch on this instead of on
 * the concrete exception class.
 */
public enum ErrorKind {
    /** Empty filename, malformed or negative number, wrong argument count. */
    VALIDATION,
    /** Filename not registered. */
    NOT_FOUND,
    /** Filename already registered, or active version already a snapshot. */
    CONFLICT,
    /** No parent version to roll back to. */
    STATE,
    /** Version id or requested k outside the valid range. */
    RANGE
}
