package io.vfslite.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One point in a file's version tree.
 * <p>
 * Fields:
 *  - id:            dense id within the owning tree, 0 for the root.
 *  - content:       file content at this version (any characters).
 *  - message:       snapshot message; empty until the node is snapshotted.
 *  - createdAt:     set once when the node is created.
 *  - snapshottedAt: null until {@link VersionTree#snapshot(String)} marks
 *                   the node, then fixed.
 *  - parentId:      arena index of the parent, or {@link #NO_PARENT}.
 *  - children:      arena indices of nodes branched from this one, in
 *                   creation order.
 * <p>
 * Invariants:
 *  - Once snapshotted, content and message never change again.
 *  - Only the owning {@link VersionTree} mutates a node (package-private setters).
 */
public final class VersionNode {

    /** Parent id of the root node. */
    public static final int NO_PARENT = -1;

    private final int id;
    private final int parentId;
    private final Instant createdAt;
    private final List<Integer> children = new ArrayList<>();

    private String content;
    private String message = "";
    private Instant snapshottedAt;

    VersionNode(int id, int parentId, String content, Instant createdAt) {
        if (id < 0) throw new IllegalArgumentException("id must be >= 0");
        if (parentId >= id) throw new IllegalArgumentException("parent must be an earlier node");
        this.id = id;
        this.parentId = parentId;
        this.content = Objects.requireNonNull(content, "content");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public int id() { return id; }

    public String content() { return content; }

    public String message() { return message; }

    public Instant createdAt() { return createdAt; }

    public Optional<Instant> snapshottedAt() { return Optional.ofNullable(snapshottedAt); }

    public boolean isSnapshot() { return snapshottedAt != null; }

    /** Arena index of the parent, or {@link #NO_PARENT} for the root. */
    public int parentId() { return parentId; }

    public boolean isRoot() { return parentId == NO_PARENT; }

    /** Child ids in creation order (read-only view). */
    public List<Integer> children() { return Collections.unmodifiableList(children); }

    // ---------- mutation, owning tree only ----------

    void appendContent(String text) {
        requireMutable();
        content = content + text;
    }

    void replaceContent(String text) {
        requireMutable();
        content = text;
    }

    void markSnapshot(String message, Instant at) {
        requireMutable();
        this.message = message;
        this.snapshottedAt = at;
    }

    void addChild(int childId) {
        children.add(childId);
    }

    private void requireMutable() {
        if (snapshottedAt != null) {
            throw new IllegalStateException("version " + id + " is a snapshot and cannot change");
        }
    }

    @Override
    public String toString() {
        return "VersionNode{id=" + id
                + ", parent=" + parentId
                + ", snapshot=" + (snapshottedAt != null)
                + ", children=" + children + "}";
    }
}
