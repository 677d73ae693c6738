package io.vfslite.shell.repl;

import io.vfslite.core.ErrorKind;
import io.vfslite.shell.VersionedFileService.FileState;
import io.vfslite.shell.VersionedFileService.HistoryEntry;
import io.vfslite.shell.VersionedFileService.RankedFile;
import io.vfslite.shell.command.CommandType;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Human-readable output.
 * <p>
 * Results go to {@code out}, each block followed by a blank line.
 * Errors go to {@code err} as "Error: message".
 */
public final class TextRenderer implements ResultRenderer {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ENGLISH);

    private final PrintStream out;
    private final PrintStream err;
    private final DateTimeFormatter timestamps;
    private final String prompt;

    public TextRenderer(PrintStream out, PrintStream err, ZoneId zone, String prompt) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.timestamps = TIMESTAMP.withZone(Objects.requireNonNull(zone, "zone"));
        this.prompt = prompt;
    }

    @Override
    public void created(FileState state) {
        out.println("[CREATE] File created: " + state.name());
        out.println();
    }

    @Override
    public void read(String name, String content) {
        out.println("[READ] Content of file '" + name + "':");
        out.println(content);
        out.println();
    }

    @Override
    public void inserted(String text, FileState state) {
        out.println("[INSERT] Content inserted into file '" + state.name() + "':");
        out.println(text);
        printCurrent(state);
    }

    @Override
    public void updated(String text, FileState state) {
        out.println("[UPDATE] Content updated in file '" + state.name() + "':");
        out.println(text);
        printCurrent(state);
    }

    @Override
    public void snapshotted(String message, FileState state) {
        out.println("[SNAPSHOT] Snapshot created for file '" + state.name() + "'.");
        if (!message.isEmpty()) {
            out.println("Message: " + message);
        }
        out.println();
    }

    @Override
    public void rolledBack(Integer targetId, FileState state) {
        if (targetId == null) {
            out.println("[ROLLBACK] File '" + state.name() + "' rolled back to previous version.");
        } else {
            out.println("[ROLLBACK] File '" + state.name() + "' rolled back to version " + targetId + ".");
        }
        printCurrent(state);
    }

    @Override
    public void history(String name, List<HistoryEntry> entries) {
        out.println("[HISTORY] Snapshots for file '" + name + "':");
        if (entries.isEmpty()) {
            out.println("(no snapshots yet)");
        }
        for (HistoryEntry e : entries) {
            out.println("Version " + e.versionId()
                    + " | Created: " + format(e.createdAt())
                    + " | Snapshot: " + format(e.snapshottedAt())
                    + " | Message: " + e.message());
        }
        out.println();
    }

    @Override
    public void recentFiles(List<RankedFile<Instant>> files) {
        out.println("[RECENT_FILES] Showing " + files.size() + " file(s):");
        for (RankedFile<Instant> f : files) {
            out.println(f.name() + " -> " + format(f.key()));
        }
        out.println();
    }

    @Override
    public void biggestTrees(List<RankedFile<Integer>> files) {
        out.println("[BIGGEST_TREES] Showing " + files.size() + " file(s) by version count:");
        for (RankedFile<Integer> f : files) {
            out.println(f.key() + " -> " + f.name());
        }
        out.println();
    }

    @Override
    public void help(List<CommandType> commands) {
        out.println("Available commands:");
        for (CommandType c : commands) {
            out.println("  " + c.usage());
        }
        out.println();
    }

    @Override
    public void exit() {
        out.println("Exiting...");
    }

    @Override
    public void error(ErrorKind kind, String message) {
        err.println("Error: " + message);
        out.println();
    }

    @Override
    public void prompt() {
        if (prompt != null && !prompt.isEmpty()) {
            out.print(prompt);
            out.flush();
        }
    }

    private void printCurrent(FileState state) {
        out.println("Current content:");
        out.println(state.content());
        out.println();
    }

    private String format(Instant t) {
        return timestamps.format(t);
    }
}
