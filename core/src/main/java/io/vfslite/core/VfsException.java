package io.vfslite.core;

import java.util.Objects;

/**
 * Base class for every failure the versioned file system reports to its caller.
 * <p>
 * All subclasses are unchecked. The shell catches this type, renders the
 * message and keeps reading commands; nothing in core retries.
 */
public abstract class VfsException extends RuntimeException {

    private final ErrorKind kind;

    protected VfsException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() { return kind; }
}
