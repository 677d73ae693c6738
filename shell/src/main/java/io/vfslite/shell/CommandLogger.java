// file: shell/src/main/java/io/vfslite/shell/CommandLogger.java
package io.vfslite.shell;

import io.vfslite.core.VfsException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log processed shell commands and their latency.
 *
 * Levels:
 *  - FINE:    successful commands and user errors (bad input, unknown file, ...).
 *  - WARNING: unexpected failures, with the stack trace.
 */
public final class CommandLogger {
    private static final Logger log = Logger.getLogger(CommandLogger.class.getName());

    private CommandLogger() {
        // utility
    }

    /**
     * Log a completed command.
     *
     * @param command     command word (CREATE, INSERT, ...)
     * @param filename    target file, or null for file-less commands
     * @param totalMicros wall-clock latency of the whole command
     * @param error       failure, or null on success
     */
    public static void logCommand(String command, String filename, long totalMicros, Throwable error) {
        if (!log.isLoggable(Level.FINE) && (error == null || error instanceof VfsException)) {
            return;
        }
        String target = filename == null ? "" : " " + filename;
        if (error == null) {
            log.log(Level.FINE, String.format("%s%s -> ok (%dus)", command, target, totalMicros));
        } else if (error instanceof VfsException vfs) {
            log.log(Level.FINE, String.format("%s%s -> %s: %s (%dus)",
                    command, target, vfs.kind(), vfs.getMessage(), totalMicros));
        } else {
            log.log(Level.WARNING, String.format("%s%s -> failed (%dus)", command, target, totalMicros), error);
        }
    }
}
