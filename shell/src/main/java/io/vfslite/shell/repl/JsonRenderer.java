package io.vfslite.shell.repl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vfslite.core.ErrorKind;
import io.vfslite.shell.VersionedFileService.FileState;
import io.vfslite.shell.VersionedFileService.HistoryEntry;
import io.vfslite.shell.VersionedFileService.RankedFile;
import io.vfslite.shell.command.CommandType;
import io.vfslite.shell.dto.*;

import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Machine-readable output: exactly one JSON object per line for every
 * command, errors included, all on {@code out}.
 */
public final class JsonRenderer implements ResultRenderer {
    private static final Logger log = Logger.getLogger(JsonRenderer.class.getName());

    private final ObjectMapper json;
    private final PrintStream out;

    public JsonRenderer(ObjectMapper json, PrintStream out) {
        this.json = Objects.requireNonNull(json, "json");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void created(FileState state) {
        send(fileState("CREATE", state));
    }

    @Override
    public void read(String name, String content) {
        var resp = new ReadResponse();
        resp.file = name;
        resp.content = content;
        send(resp);
    }

    @Override
    public void inserted(String text, FileState state) {
        send(fileState("INSERT", state));
    }

    @Override
    public void updated(String text, FileState state) {
        send(fileState("UPDATE", state));
    }

    @Override
    public void snapshotted(String message, FileState state) {
        send(fileState("SNAPSHOT", state));
    }

    @Override
    public void rolledBack(Integer targetId, FileState state) {
        send(fileState("ROLLBACK", state));
    }

    @Override
    public void history(String name, List<HistoryEntry> entries) {
        var resp = new HistoryResponse();
        resp.file = name;
        resp.versions = entries.stream().map(e -> {
            var r = new HistoryResponse.VersionRecord();
            r.versionId = e.versionId();
            r.createdMillis = e.createdAt().toEpochMilli();
            r.snapshotMillis = e.snapshottedAt().toEpochMilli();
            r.message = e.message();
            return r;
        }).toList();
        send(resp);
    }

    @Override
    public void recentFiles(List<RankedFile<Instant>> files) {
        var resp = new RankedFilesResponse();
        resp.command = "RECENT_FILES";
        resp.files = files.stream().map(f -> {
            var r = new RankedFilesResponse.RankedRecord();
            r.file = f.name();
            r.lastModifiedMillis = f.key().toEpochMilli();
            return r;
        }).toList();
        send(resp);
    }

    @Override
    public void biggestTrees(List<RankedFile<Integer>> files) {
        var resp = new RankedFilesResponse();
        resp.command = "BIGGEST_TREES";
        resp.files = files.stream().map(f -> {
            var r = new RankedFilesResponse.RankedRecord();
            r.file = f.name();
            r.totalVersions = f.key();
            return r;
        }).toList();
        send(resp);
    }

    @Override
    public void help(List<CommandType> commands) {
        var resp = new MessageResponse();
        resp.command = "HELP";
        resp.lines = commands.stream().map(CommandType::usage).toList();
        send(resp);
    }

    @Override
    public void exit() {
        var resp = new MessageResponse();
        resp.command = "EXIT";
        resp.lines = List.of("Exiting...");
        send(resp);
    }

    @Override
    public void error(ErrorKind kind, String message) {
        var resp = new ErrorResponse();
        resp.error = new ErrorResponse.ErrorBody();
        resp.error.kind = kind == null ? "INTERNAL" : kind.name();
        resp.error.message = message;
        send(resp);
    }

    // ---------- helpers ----------

    private static FileStateResponse fileState(String command, FileState state) {
        var resp = new FileStateResponse();
        resp.command = command;
        resp.file = state.name();
        resp.activeVersion = state.activeId();
        resp.content = state.content();
        resp.activeIsSnapshot = state.activeIsSnapshot();
        resp.totalVersions = state.totalVersions();
        resp.lastModifiedMillis = state.lastModified().toEpochMilli();
        return resp;
    }

    /** Serialize 'body' as a single JSON line. */
    private void send(Object body) {
        try {
            out.println(json.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            log.log(Level.WARNING, "failed to serialize " + body.getClass().getSimpleName(), e);
            out.println("{\"ok\":false,\"error\":{\"kind\":\"INTERNAL\",\"message\":\"serialization\"}}");
        }
        out.flush();
    }
}
