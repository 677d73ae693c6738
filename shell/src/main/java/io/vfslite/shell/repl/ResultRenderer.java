package io.vfslite.shell.repl;

import io.vfslite.core.ErrorKind;
import io.vfslite.shell.VersionedFileService.FileState;
import io.vfslite.shell.VersionedFileService.HistoryEntry;
import io.vfslite.shell.VersionedFileService.RankedFile;
import io.vfslite.shell.command.CommandType;

import java.time.Instant;
import java.util.List;

/**
 * Output side of the shell: one callback per command outcome.
 * <p>
 * Implementations decide the format (human text or JSON lines) and which
 * stream each outcome goes to. The {@link Repl} never prints directly.
 */
public interface ResultRenderer {

    void created(FileState state);

    void read(String name, String content);

    void inserted(String text, FileState state);

    void updated(String text, FileState state);

    void snapshotted(String message, FileState state);

    /**
     * @param targetId requested version id, or null for a rollback to the parent
     */
    void rolledBack(Integer targetId, FileState state);

    void history(String name, List<HistoryEntry> entries);

    void recentFiles(List<RankedFile<Instant>> files);

    void biggestTrees(List<RankedFile<Integer>> files);

    void help(List<CommandType> commands);

    void exit();

    /**
     * @param kind error category, or null for an unexpected internal failure
     */
    void error(ErrorKind kind, String message);

    /** Printed before reading each line; no-op by default. */
    default void prompt() {
    }
}
