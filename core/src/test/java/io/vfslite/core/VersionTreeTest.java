package io.vfslite.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour of a single file's version tree: in-place edits, branching on
 * snapshots, rollback/checkout and history.
 */
class VersionTreeTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private VersionTree tree;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        tree = new VersionTree(clock);
    }

    @Test
    void new_tree_has_single_snapshotted_empty_root() {
        assertEquals("", tree.read());
        assertEquals(1, tree.totalVersions());
        assertEquals(0, tree.activeId());

        VersionNode root = tree.root();
        assertTrue(root.isRoot());
        assertTrue(root.isSnapshot());
        assertEquals("", root.message());
        assertEquals(T0, root.createdAt());
        assertEquals(T0, root.snapshottedAt().orElseThrow());

        List<VersionNode> history = tree.history();
        assertEquals(1, history.size());
        assertSame(root, history.get(0));
    }

    @Test
    void insert_on_snapshot_branches_child_with_concatenated_content() {
        int expectedId = tree.totalVersions();
        VersionNode child = tree.insertContent("hello");

        assertEquals(expectedId, child.id());
        assertEquals("hello", child.content());
        assertEquals(0, child.parentId());
        assertEquals(List.of(child.id()), tree.root().children());
        assertEquals(2, tree.totalVersions());
        assertSame(child, tree.active());
    }

    @Test
    void insert_on_mutable_node_appends_in_place() {
        VersionNode first = tree.insertContent("a");
        VersionNode again = tree.insertContent(" b  c");

        assertSame(first, again);
        assertEquals("a b  c", tree.read());
        assertEquals(2, tree.totalVersions());
    }

    @Test
    void update_replaces_in_place_or_branches_with_exact_text() {
        tree.insertContent("draft");
        tree.updateContent("final");
        assertEquals("final", tree.read());
        assertEquals(2, tree.totalVersions());

        tree.snapshot("v1");
        VersionNode branched = tree.updateContent("rewrite");
        assertEquals(2, branched.id());
        assertEquals("rewrite", branched.content());
        assertEquals(1, branched.parentId());
    }

    @Test
    void snapshot_twice_without_edit_conflicts() {
        tree.insertContent("x");
        tree.snapshot("first");

        var ex = assertThrows(ConflictException.class, () -> tree.snapshot("second"));
        assertEquals(ErrorKind.CONFLICT, ex.kind());
        assertEquals("first", tree.active().message());
    }

    @Test
    void snapshot_on_fresh_tree_conflicts_because_root_is_frozen() {
        assertThrows(ConflictException.class, () -> tree.snapshot());
    }

    @Test
    void snapshotted_content_is_never_rewritten() {
        tree.insertContent("X");
        VersionNode frozen = tree.snapshot("m1");
        tree.insertContent("Y");
        tree.updateContent("Z");

        assertEquals("X", frozen.content());
        assertEquals("m1", frozen.message());
        assertEquals("Z", tree.read());
    }

    @Test
    void rollback_without_id_moves_to_parent_and_fails_at_root() {
        tree.insertContent("X");
        tree.snapshot();
        tree.insertContent("Y");
        assertEquals(2, tree.activeId());

        VersionNode parent = tree.rollback();
        assertEquals(1, parent.id());
        assertEquals("X", tree.read());

        tree.rollback();
        assertEquals(0, tree.activeId());

        var ex = assertThrows(StateException.class, () -> tree.rollback());
        assertEquals(ErrorKind.STATE, ex.kind());
        assertEquals(0, tree.activeId());
    }

    @Test
    void rollback_by_id_jumps_across_branches() {
        // 0 -> 1 ("A") ; 0 -> 2 ("B")
        tree.insertContent("A");
        tree.snapshot("a");
        tree.rollback(0);
        tree.insertContent("B");
        assertEquals(2, tree.activeId());
        assertEquals(List.of(1, 2), tree.root().children());

        // node 1 is not an ancestor of node 2, jump anyway
        tree.rollback(1);
        assertEquals("A", tree.read());
        assertEquals(3, tree.totalVersions());
    }

    @Test
    void rollback_by_id_rejects_out_of_range() {
        tree.insertContent("A");
        assertThrows(OutOfRangeException.class, () -> tree.rollback(2));
        assertThrows(OutOfRangeException.class, () -> tree.rollback(-1));
        assertEquals(1, tree.activeId());
    }

    @Test
    void history_lists_only_snapshots_from_root_to_active() {
        tree.insertContent("1");
        tree.snapshot("s1");
        tree.insertContent("2");     // node 2, not snapshotted
        tree.snapshot("s2");
        tree.insertContent("3");     // node 3, left mutable

        List<VersionNode> history = tree.history();
        assertEquals(List.of(0, 1, 2), history.stream().map(VersionNode::id).toList());
        assertTrue(history.stream().allMatch(VersionNode::isSnapshot));

        // a sibling branch is not on the path
        tree.rollback(0);
        assertEquals(List.of(0), tree.history().stream().map(VersionNode::id).toList());
    }

    @Test
    void worked_example_insert_snapshot_insert_rollback() {
        tree.insertContent("X");
        assertEquals("X", tree.read());
        assertEquals(2, tree.totalVersions());

        tree.snapshot("m1");
        assertEquals(2, tree.totalVersions());

        VersionNode next = tree.insertContent("Y");
        assertEquals(2, next.id());
        assertEquals("XY", tree.read());
        assertEquals(3, tree.totalVersions());

        tree.rollback();
        assertEquals("X", tree.read());
        assertEquals(List.of("", "m1"), tree.history().stream().map(VersionNode::message).toList());
    }

    @Test
    void mutations_advance_last_modified() {
        assertEquals(T0, tree.lastModified());

        clock.advance(Duration.ofSeconds(5));
        tree.insertContent("x");
        assertEquals(T0.plusSeconds(5), tree.lastModified());

        clock.advance(Duration.ofSeconds(5));
        tree.snapshot("s");
        assertEquals(T0.plusSeconds(10), tree.lastModified());
        assertEquals(T0.plusSeconds(10), tree.active().snapshottedAt().orElseThrow());

        clock.advance(Duration.ofSeconds(5));
        tree.rollback();
        assertEquals(T0.plusSeconds(15), tree.lastModified());

        clock.advance(Duration.ofSeconds(5));
        tree.read();
        tree.history();
        assertEquals(T0.plusSeconds(15), tree.lastModified());
        assertEquals(T0, tree.createdAt());
    }

    @Test
    void node_lookup_by_id() {
        tree.insertContent("a");
        assertEquals("a", tree.node(1).content());
        assertThrows(OutOfRangeException.class, () -> tree.node(7));
    }
}
