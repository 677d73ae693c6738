package io.vfslite.shell;

import io.vfslite.core.VersionNode;
import io.vfslite.core.VersionTree;
import io.vfslite.core.rank.RankedIndex;
import io.vfslite.storage.FileRegistry;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service for versioned-file operations.
 *
 * Responsibilities:
 *  - Resolve filenames through the {@link FileRegistry}.
 *  - Invoke exactly one operation on the file's {@link VersionTree}.
 *  - Keep the two rankings in step with the trees:
 *      - recency:       key = tree.lastModified(), refreshed on every mutation
 *                       (create, insert, update, snapshot, rollback);
 *      - version count: key = tree.totalVersions(), refreshed on create,
 *                       insert and update (the only operations that can add nodes).
 *  - Convert tree state into small view models for the shell renderers.
 *
 * Top-k queries read the indices without mutating them, so they can be
 * interleaved freely with updates.
 */
public final class VersionedFileService {
    private static final Logger log = Logger.getLogger(VersionedFileService.class.getName());

    private final FileRegistry registry;
    private final RankedIndex<Instant> byRecency = new RankedIndex<>();
    private final RankedIndex<Integer> byVersionCount = new RankedIndex<>();

    public VersionedFileService(FileRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Register a new, empty file. */
    public FileState create(String name) {
        VersionTree tree = registry.create(name);
        reindexRecency(name, tree);
        reindexVersionCount(name, tree);
        log.log(Level.FINE, () -> "created file " + name);
        return FileState.of(name, tree);
    }

    public String read(String name) {
        return registry.lookup(name).read();
    }

    /** Append text to the active version (branching if it is a snapshot). */
    public FileState insert(String name, String text) {
        VersionTree tree = registry.lookup(name);
        tree.insertContent(text);
        reindexRecency(name, tree);
        reindexVersionCount(name, tree);
        return FileState.of(name, tree);
    }

    /** Replace the active version's content (branching if it is a snapshot). */
    public FileState update(String name, String text) {
        VersionTree tree = registry.lookup(name);
        tree.updateContent(text);
        reindexRecency(name, tree);
        reindexVersionCount(name, tree);
        return FileState.of(name, tree);
    }

    public FileState snapshot(String name, String message) {
        VersionTree tree = registry.lookup(name);
        tree.snapshot(message);
        reindexRecency(name, tree);
        return FileState.of(name, tree);
    }

    /** Move the active version to its parent. */
    public FileState rollback(String name) {
        VersionTree tree = registry.lookup(name);
        tree.rollback();
        reindexRecency(name, tree);
        return FileState.of(name, tree);
    }

    /** Check out any version by id. */
    public FileState rollback(String name, int versionId) {
        VersionTree tree = registry.lookup(name);
        tree.rollback(versionId);
        reindexRecency(name, tree);
        return FileState.of(name, tree);
    }

    /** Snapshots on the current branch, root first. */
    public List<HistoryEntry> history(String name) {
        return registry.lookup(name).history().stream()
                .map(HistoryEntry::of)
                .toList();
    }

    /** Every file, most recently modified first. */
    public List<RankedFile<Instant>> recentFiles() {
        return ranked(byRecency.topK());
    }

    public List<RankedFile<Instant>> recentFiles(int k) {
        return ranked(byRecency.topK(k));
    }

    /** Every file, largest version count first. */
    public List<RankedFile<Integer>> biggestTrees() {
        return ranked(byVersionCount.topK());
    }

    public List<RankedFile<Integer>> biggestTrees(int k) {
        return ranked(byVersionCount.topK(k));
    }

    public int fileCount() {
        return registry.size();
    }

    // ------------ view models ------------

    /** State of a file after an operation. */
    public record FileState(
            String name,
            int activeId,
            String content,
            boolean activeIsSnapshot,
            int totalVersions,
            Instant lastModified
    ) {
        static FileState of(String name, VersionTree tree) {
            VersionNode active = tree.active();
            return new FileState(
                    name,
                    active.id(),
                    active.content(),
                    active.isSnapshot(),
                    tree.totalVersions(),
                    tree.lastModified()
            );
        }
    }

    /** One snapshotted version on the current branch. */
    public record HistoryEntry(int versionId, Instant createdAt, Instant snapshottedAt, String message) {
        static HistoryEntry of(VersionNode node) {
            return new HistoryEntry(
                    node.id(),
                    node.createdAt(),
                    node.snapshottedAt().orElseThrow(),
                    node.message()
            );
        }
    }

    /** One row of a top-k answer. */
    public record RankedFile<K>(String name, K key) {}

    // ------------ helpers ------------

    private void reindexRecency(String name, VersionTree tree) {
        byRecency.upsert(tree.lastModified(), name);
    }

    private void reindexVersionCount(String name, VersionTree tree) {
        byVersionCount.upsert(tree.totalVersions(), name);
    }

    private static <K> List<RankedFile<K>> ranked(List<RankedIndex.Entry<K>> entries) {
        return entries.stream()
                .map(e -> new RankedFile<>(e.filename(), e.key()))
                .toList();
    }
}
