package io.vfslite.core.rank;

import io.vfslite.core.OutOfRangeException;
import io.vfslite.core.ValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Max-priority index over (key, filename) pairs with removal by filename.
 * <p>
 * Layout:
 *  - heap:      array-backed binary max-heap; children of i are 2i+1 and 2i+2.
 *  - positions: filename -> current slot in {@code heap}.
 * <p>
 * Every swap updates {@code positions} for both moved entries before the next
 * comparison, so removeByFilename() can find any entry in O(1) and repair the
 * heap in O(log n).
 * <p>
 * Ordering: higher key first. Equal keys are ordered by filename ascending,
 * which keeps topK() output deterministic for a given sequence of calls.
 * <p>
 * One instance is used per ranking (recency by {@code Instant}, size by
 * version count). Not thread safe; a concurrent caller must guard the heap
 * and the position map with a single lock.
 *
 * @param <K> rank key type
 */
public final class RankedIndex<K extends Comparable<? super K>> {

    /**
     * One indexed file.
     *
     * @param key      rank key (timestamp, version count, ...)
     * @param filename file this entry ranks
     */
    public record Entry<K>(K key, String filename) {
        public Entry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(filename, "filename");
        }
    }

    private final List<Entry<K>> heap;
    private final Map<String, Integer> positions;

    public RankedIndex() {
        this.heap = new ArrayList<>();
        this.positions = new HashMap<>();
    }

    private RankedIndex(RankedIndex<K> source) {
        this.heap = new ArrayList<>(source.heap);
        this.positions = new HashMap<>(source.positions);
    }

    /**
     * Add a file with the given key.
     *
     * @throws IllegalArgumentException if the filename is already indexed;
     *                                  use {@link #upsert} to replace an entry
     */
    public void insert(K key, String filename) {
        var entry = new Entry<>(key, filename);
        if (positions.containsKey(filename)) {
            throw new IllegalArgumentException("already indexed: " + filename);
        }
        heap.add(entry);
        int slot = heap.size() - 1;
        positions.put(filename, slot);
        siftUp(slot);
    }

    /**
     * Remove the entry for a filename.
     * <p>
     * Unknown filenames are ignored: the first update of a file that has not
     * been indexed yet goes through here too.
     *
     * @return true if an entry was removed
     */
    public boolean removeByFilename(String filename) {
        Integer pos = positions.get(filename);
        if (pos == null) {
            return false;
        }
        int last = heap.size() - 1;
        swap(pos, last);
        heap.remove(last);
        positions.remove(filename);

        // The former last entry now sits at pos and may be out of order in
        // either direction.
        if (pos < heap.size()) {
            int moved = siftUp(pos);
            siftDown(moved);
        }
        return true;
    }

    /** Replace the entry for {@code filename} (or add it) with a new key. */
    public void upsert(K key, String filename) {
        removeByFilename(filename);
        insert(key, filename);
    }

    /** All entries, highest key first. */
    public List<Entry<K>> topK() {
        return topK(heap.size());
    }

    /**
     * The {@code k} highest entries, highest first.
     * <p>
     * The live index is left untouched: extraction runs on a copy.
     *
     * @throws ValidationException  if {@code k} is negative
     * @throws OutOfRangeException  if {@code k} exceeds the number of indexed files
     */
    public List<Entry<K>> topK(int k) {
        if (k < 0) {
            throw new ValidationException("k must be a non-negative integer, got " + k);
        }
        if (k > heap.size()) {
            throw new OutOfRangeException(
                    "requested " + k + " entries but only " + heap.size() + " file(s) are indexed");
        }
        RankedIndex<K> scratch = new RankedIndex<>(this);
        List<Entry<K>> out = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            out.add(scratch.poll());
        }
        return out;
    }

    /** Highest entry without removing it. */
    public Optional<Entry<K>> peek() {
        return heap.isEmpty() ? Optional.empty() : Optional.of(heap.get(0));
    }

    public Optional<K> keyOf(String filename) {
        Integer pos = positions.get(filename);
        return pos == null ? Optional.empty() : Optional.of(heap.get(pos).key());
    }

    public boolean contains(String filename) { return positions.containsKey(filename); }

    public int size() { return heap.size(); }

    public boolean isEmpty() { return heap.isEmpty(); }

    // ---------- heap internals ----------

    private Entry<K> poll() {
        Entry<K> top = heap.get(0);
        removeByFilename(top.filename());
        return top;
    }

    /** @return the slot the entry ended up in */
    private int siftUp(int i) {
        while (i > 0) {
            int parent = (i - 1) / 2;
            if (!higher(heap.get(i), heap.get(parent))) {
                break;
            }
            swap(i, parent);
            i = parent;
        }
        return i;
    }

    private void siftDown(int i) {
        int n = heap.size();
        while (true) {
            int left = 2 * i + 1;
            int right = left + 1;
            int best = i;
            if (left < n && higher(heap.get(left), heap.get(best))) {
                best = left;
            }
            if (right < n && higher(heap.get(right), heap.get(best))) {
                best = right;
            }
            if (best == i) {
                return;
            }
            swap(i, best);
            i = best;
        }
    }

    private void swap(int i, int j) {
        if (i == j) {
            return;
        }
        Entry<K> a = heap.get(i);
        Entry<K> b = heap.get(j);
        heap.set(i, b);
        heap.set(j, a);
        positions.put(b.filename(), i);
        positions.put(a.filename(), j);
    }

    /** True if {@code a} ranks strictly above {@code b}. */
    private boolean higher(Entry<K> a, Entry<K> b) {
        int byKey = a.key().compareTo(b.key());
        if (byKey != 0) {
            return byKey > 0;
        }
        return a.filename().compareTo(b.filename()) < 0;
    }
}
