// file: bench/src/main/java/io/vfslite/bench/ZipfianFilePicker.java
package io.vfslite.bench;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Picks bench files with a Zipfian skew: the file at rank 0 is the hottest.
 *
 * Probability of rank r is proportional to 1 / (r + 1)^skew. The cumulative
 * table is built once and sampled with {@link Arrays#binarySearch}.
 */
public final class ZipfianFilePicker {

    private final List<String> files;
    private final double skew;
    private final double[] cumulative;
    private final Random rnd;

    public ZipfianFilePicker(List<String> files, double skew, long seed) {
        if (files.isEmpty()) throw new IllegalArgumentException("at least one file is required");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        this.files = List.copyOf(files);
        this.skew = skew;
        this.rnd = new Random(seed);
        this.cumulative = new double[this.files.size()];

        double total = 0.0;
        for (int r = 0; r < cumulative.length; r++) {
            total += weight(r);
            cumulative[r] = total;
        }
        for (int r = 0; r < cumulative.length; r++) {
            cumulative[r] /= total;
        }
        cumulative[cumulative.length - 1] = 1.0;
    }

    /** Next file, skewed towards low ranks. */
    public String nextFile() {
        return files.get(nextRank());
    }

    /** Rank in [0, files) of the next pick. */
    public int nextRank() {
        int slot = Arrays.binarySearch(cumulative, rnd.nextDouble());
        // binarySearch returns (-(insertion point) - 1) on a miss
        return slot >= 0 ? slot : -slot - 1;
    }

    /** Expected fraction of picks that land on {@code rank}. */
    public double share(int rank) {
        if (rank < 0 || rank >= cumulative.length) {
            throw new IndexOutOfBoundsException("rank " + rank + " outside 0.." + (cumulative.length - 1));
        }
        return rank == 0 ? cumulative[0] : cumulative[rank] - cumulative[rank - 1];
    }

    /** Uniform draw in [0, bound) from the same seeded source, for the op mix. */
    public int roll(int bound) {
        return rnd.nextInt(bound);
    }

    public int fileCount() {
        return files.size();
    }

    private double weight(int rank) {
        return 1.0 / Math.pow(rank + 1, skew);
    }
}
