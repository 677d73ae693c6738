// file: src/main/java/io/vfslite/core/VersionTree.java
package io.vfslite.core;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Version tree for a single file.
 * <p>
 * Every node the tree has ever created lives in an append-only arena, so the
 * node with id {@code n} is always {@code arena.get(n)} and nothing is ever
 * freed. Parent/child links are arena indices.
 * <p>
 * State machine:
 *  - The active node is the one read(), insertContent() and updateContent()
 *    operate on.
 *  - While the active node is not a snapshot it is edited in place.
 *  - Once it is a snapshot, the next edit branches a new child off it and
 *    that child becomes active.
 *  - rollback() moves the active pointer; it never creates or drops nodes.
 * <p>
 * Not thread safe. A concurrent caller would need one lock per tree around
 * every mutating method.
 */
public final class VersionTree {

    private final Clock clock;
    private final List<VersionNode> arena = new ArrayList<>();
    private final Instant createdAt;

    private int activeId;
    private Instant lastModified;

    /**
     * Create a tree with an empty root, snapshotted immediately with an empty message.
     */
    public VersionTree(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Instant now = clock.instant();
        this.createdAt = now;
        this.lastModified = now;

        VersionNode root = new VersionNode(0, VersionNode.NO_PARENT, "", now);
        arena.add(root);
        this.activeId = 0;
        snapshot("");
    }

    /** Content of the active version. */
    public String read() {
        return active().content();
    }

    /**
     * Append text to the active version, or to a new child if the active
     * version is a snapshot.
     *
     * @return the node that now holds the content (same node or the new child)
     */
    public VersionNode insertContent(String text) {
        Objects.requireNonNull(text, "text");
        Instant now = clock.instant();
        lastModified = now;

        VersionNode current = active();
        if (!current.isSnapshot()) {
            current.appendContent(text);
            return current;
        }
        return branch(current, current.content() + text, now);
    }

    /**
     * Replace the active version's content, or branch a new child holding
     * exactly {@code text} if the active version is a snapshot.
     */
    public VersionNode updateContent(String text) {
        Objects.requireNonNull(text, "text");
        Instant now = clock.instant();
        lastModified = now;

        VersionNode current = active();
        if (!current.isSnapshot()) {
            current.replaceContent(text);
            return current;
        }
        return branch(current, text, now);
    }

    /** Snapshot the active version with an empty message. */
    public VersionNode snapshot() {
        return snapshot("");
    }

    /**
     * Freeze the active version.
     *
     * @throws ConflictException if the active version is already a snapshot
     */
    public VersionNode snapshot(String message) {
        Objects.requireNonNull(message, "message");
        VersionNode current = active();
        if (current.isSnapshot()) {
            throw new ConflictException("Current version is already a snapshot");
        }
        Instant now = clock.instant();
        current.markSnapshot(message, now);
        lastModified = now;
        return current;
    }

    /**
     * Move the active pointer to the parent of the active version.
     *
     * @throws StateException if the active version is the root
     */
    public VersionNode rollback() {
        VersionNode current = active();
        if (current.isRoot()) {
            throw new StateException("No parent version to rollback to");
        }
        activeId = current.parentId();
        lastModified = clock.instant();
        return active();
    }

    /**
     * Check out any version by id.
     * <p>
     * The target does not have to be an ancestor of the active version;
     * jumping sideways onto another branch is allowed.
     *
     * @throws OutOfRangeException if {@code id} is not in [0, totalVersions())
     */
    public VersionNode rollback(int id) {
        if (id < 0 || id >= arena.size()) {
            throw new OutOfRangeException(
                    "Invalid version id for rollback: " + id + " (valid range 0.." + (arena.size() - 1) + ")");
        }
        activeId = id;
        lastModified = clock.instant();
        return active();
    }

    /**
     * Snapshotted versions on the path from the root to the active version,
     * root first. Non-snapshot nodes on the path are skipped.
     */
    public List<VersionNode> history() {
        List<VersionNode> path = new ArrayList<>();
        int cursor = activeId;
        while (cursor != VersionNode.NO_PARENT) {
            VersionNode node = arena.get(cursor);
            if (node.isSnapshot()) {
                path.add(node);
            }
            cursor = node.parentId();
        }
        Collections.reverse(path);
        return path;
    }

    public VersionNode active() { return arena.get(activeId); }

    public int activeId() { return activeId; }

    public VersionNode root() { return arena.get(0); }

    /**
     * Any version ever created, by id.
     *
     * @throws OutOfRangeException if {@code id} is unknown
     */
    public VersionNode node(int id) {
        if (id < 0 || id >= arena.size()) {
            throw new OutOfRangeException("Unknown version id: " + id);
        }
        return arena.get(id);
    }

    /** Number of versions ever created, including the root. */
    public int totalVersions() { return arena.size(); }

    public Instant lastModified() { return lastModified; }

    public Instant createdAt() { return createdAt; }

    // ---------- helpers ----------

    private VersionNode branch(VersionNode parent, String content, Instant now) {
        VersionNode child = new VersionNode(arena.size(), parent.id(), content, now);
        arena.add(child);
        parent.addChild(child.id());
        activeId = child.id();
        return child;
    }
}
