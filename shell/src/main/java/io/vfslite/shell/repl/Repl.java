package io.vfslite.shell.repl;

import io.vfslite.core.VfsException;
import io.vfslite.shell.CommandLogger;
import io.vfslite.shell.VersionedFileService;
import io.vfslite.shell.command.Command;
import io.vfslite.shell.command.CommandParser;
import io.vfslite.shell.command.CommandType;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Line-oriented command loop.
 *
 * Responsibilities:
 *  - Read one line at a time and parse it with {@link CommandParser}.
 *  - Dispatch the command to {@link VersionedFileService}.
 *  - Hand the outcome to a {@link ResultRenderer}.
 *  - Catch every failure, report it and keep going: a bad command never ends the session.
 *
 * The loop ends on EXIT or at end of input.
 */
public final class Repl {

    private final VersionedFileService service;
    private final ResultRenderer renderer;

    public Repl(VersionedFileService service, ResultRenderer renderer) {
        this.service = Objects.requireNonNull(service, "service");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * Run until EXIT or end of input.
     *
     * @return number of lines processed (blank lines included)
     */
    public int run(BufferedReader in) throws IOException {
        int lines = 0;
        while (true) {
            renderer.prompt();
            String line = in.readLine();
            if (line == null) {
                return lines;
            }
            lines++;
            if (!execute(line)) {
                return lines;
            }
        }
    }

    /**
     * Execute a single line.
     *
     * @return false if the line was EXIT, true otherwise
     */
    public boolean execute(String line) {
        long start = System.nanoTime();
        String word = null;
        String file = null;
        try {
            Optional<Command> parsed = CommandParser.parse(line);
            if (parsed.isEmpty()) {
                return true;
            }
            Command cmd = parsed.get();
            word = cmd.type().name();
            file = cmd.filename();

            boolean keepGoing = dispatch(cmd);
            CommandLogger.logCommand(word, file, micros(start), null);
            return keepGoing;
        } catch (VfsException e) {
            CommandLogger.logCommand(word == null ? "?" : word, file, micros(start), e);
            renderer.error(e.kind(), e.getMessage());
            return true;
        } catch (RuntimeException e) {
            CommandLogger.logCommand(word == null ? "?" : word, file, micros(start), e);
            renderer.error(null, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            return true;
        }
    }

    private boolean dispatch(Command cmd) {
        String file = cmd.filename();
        switch (cmd.type()) {
            case CREATE -> renderer.created(service.create(file));
            case READ -> renderer.read(file, service.read(file));
            case INSERT -> renderer.inserted(cmd.text(), service.insert(file, cmd.text()));
            case UPDATE -> renderer.updated(cmd.text(), service.update(file, cmd.text()));
            case SNAPSHOT -> renderer.snapshotted(cmd.text(), service.snapshot(file, cmd.text()));
            case ROLLBACK -> {
                if (cmd.number().isPresent()) {
                    int id = cmd.number().getAsInt();
                    renderer.rolledBack(id, service.rollback(file, id));
                } else {
                    renderer.rolledBack(null, service.rollback(file));
                }
            }
            case HISTORY -> renderer.history(file, service.history(file));
            case RECENT_FILES -> renderer.recentFiles(cmd.number().isPresent()
                    ? service.recentFiles(cmd.number().getAsInt())
                    : service.recentFiles());
            case BIGGEST_TREES -> renderer.biggestTrees(cmd.number().isPresent()
                    ? service.biggestTrees(cmd.number().getAsInt())
                    : service.biggestTrees());
            case HELP -> renderer.help(List.of(CommandType.values()));
            case EXIT -> {
                renderer.exit();
                return false;
            }
        }
        return true;
    }

    private static long micros(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000;
    }
}
