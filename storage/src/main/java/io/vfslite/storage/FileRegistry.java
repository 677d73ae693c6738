// file: src/main/java/io/vfslite/storage/FileRegistry.java
package io.vfslite.storage;

import io.vfslite.core.ConflictException;
import io.vfslite.core.FileNames;
import io.vfslite.core.NotFoundException;
import io.vfslite.core.VersionTree;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory filename -> version tree map.
 * <p>
 * Semantics:
 *  - create() registers a new tree; names are unique for the registry's lifetime.
 *  - lookup() resolves a name or fails with NotFoundException.
 *  - There is no removal: a registered file lives as long as the registry.
 * <p>
 * Iteration order of names() is registration order.
 * Not thread safe; the shell drives it from a single thread.
 */
public final class FileRegistry {

    private final Map<String, VersionTree> trees = new LinkedHashMap<>();
    private final Clock clock;

    public FileRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Register a new file with a fresh tree (root version already snapshotted).
     *
     * @throws io.vfslite.core.ValidationException if the name is empty or has whitespace
     * @throws ConflictException                   if the name is already registered
     */
    public VersionTree create(String name) {
        FileNames.requireValid(name);
        if (trees.containsKey(name)) {
            throw new ConflictException("File already exists: " + name);
        }
        var tree = new VersionTree(clock);
        trees.put(name, tree);
        return tree;
    }

    /**
     * Resolve a registered file.
     *
     * @throws io.vfslite.core.ValidationException if the name is empty
     * @throws NotFoundException                   if no such file is registered
     */
    public VersionTree lookup(String name) {
        FileNames.requireValid(name);
        VersionTree tree = trees.get(name);
        if (tree == null) {
            throw new NotFoundException("File not found: " + name);
        }
        return tree;
    }

    public boolean contains(String name) { return trees.containsKey(name); }

    public int size() { return trees.size(); }

    /** Registered names in registration order (immutable copy). */
    public List<String> names() { return List.copyOf(trees.keySet()); }
}
