// file: bench/src/main/java/io/vfslite/bench/WorkloadBench.java
package io.vfslite.bench;

import io.vfslite.core.VfsException;
import io.vfslite.shell.VersionedFileService;
import io.vfslite.storage.FileRegistry;

import java.io.PrintStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process workload driver for {@link VersionedFileService}.
 *
 * Usage:
 *   java -cp bench.jar io.vfslite.bench.WorkloadBench \
 *     --files 1000 \
 *     --ops 200000 \
 *     --zipf-skew 0.99 \
 *     --seed 42 \
 *     --top-k 10
 *
 * Each op picks a file with a Zipfian distribution (a few files take most
 * of the edits, so their trees grow deep) and an operation from a fixed mix.
 * Expected failures (snapshotting a snapshot, rolling back the root) count
 * as errors, not crashes.
 *
 * Output:
 *   - Summary line per op type to stderr.
 *   - CSV to stdout with per-op latency samples:
 *       op,success,latency_us
 */
public final class WorkloadBench {

    /** Operation mix, in percent. */
    enum Op {
        INSERT(30), UPDATE(10), SNAPSHOT(20), ROLLBACK(10), READ(20), RECENT_FILES(5), BIGGEST_TREES(5);

        final int weight;

        Op(int weight) { this.weight = weight; }

        static Op pick(int roll) {
            int acc = 0;
            for (Op op : values()) {
                acc += op.weight;
                if (roll < acc) return op;
            }
            return READ;
        }
    }

    record Sample(Op op, boolean ok, double latencyMicros) {}

    /** Aggregated outcome of one run. */
    record Report(List<Sample> samples, int files, long totalVersions, double elapsedSeconds, double hottestShare) {
        long errors() {
            return samples.stream().filter(s -> !s.ok()).count();
        }
    }

    private WorkloadBench() {
    }

    public static void main(String[] args) {
        Map<String, String> cfg = parseArgs(args);

        int files = Integer.parseInt(cfg.getOrDefault("files", "1000"));
        int ops = Integer.parseInt(cfg.getOrDefault("ops", "200000"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));
        long seed = Long.parseLong(cfg.getOrDefault("seed", "42"));
        int topK = Integer.parseInt(cfg.getOrDefault("top-k", "10"));

        Report report = run(files, ops, zipfSkew, seed, topK);
        summarizeAndPrint(report, System.err, System.out);
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    static Report run(int files, int ops, double zipfSkew, long seed, int topK) {
        if (files <= 0) throw new IllegalArgumentException("files must be > 0");
        if (ops < 0) throw new IllegalArgumentException("ops must be >= 0");

        var service = new VersionedFileService(new FileRegistry(Clock.systemUTC()));
        List<String> names = new ArrayList<>(files);
        for (int i = 0; i < files; i++) {
            names.add(fileName(i));
        }
        var picker = new ZipfianFilePicker(names, zipfSkew, seed);
        int k = Math.min(topK, files);

        for (String name : names) {
            service.create(name);
        }

        List<Sample> samples = new ArrayList<>(ops);
        long began = System.nanoTime();
        for (int i = 0; i < ops; i++) {
            Op op = Op.pick(picker.roll(100));
            String file = picker.nextFile();

            long start = System.nanoTime();
            boolean ok = true;
            try {
                apply(service, op, file, i, k);
            } catch (VfsException e) {
                ok = false;
            }
            samples.add(new Sample(op, ok, (System.nanoTime() - start) / 1_000.0));
        }
        double elapsed = (System.nanoTime() - began) / 1_000_000_000.0;

        long versions = 0;
        for (var row : service.biggestTrees()) {
            versions += row.key();
        }
        return new Report(samples, files, versions, elapsed, picker.share(0));
    }

    private static void apply(VersionedFileService service, Op op, String file, int seq, int k) {
        switch (op) {
            case INSERT -> service.insert(file, " line-" + seq);
            case UPDATE -> service.update(file, "rewrite-" + seq);
            case SNAPSHOT -> service.snapshot(file, "snap-" + seq);
            case ROLLBACK -> service.rollback(file);
            case READ -> service.read(file);
            case RECENT_FILES -> service.recentFiles(k);
            case BIGGEST_TREES -> service.biggestTrees(k);
        }
    }

    static String fileName(int i) {
        return "file-" + i;
    }

    private static void summarizeAndPrint(Report report, PrintStream summary, PrintStream csv) {
        List<Sample> all = report.samples();
        if (all.isEmpty()) {
            summary.println("no samples collected");
            return;
        }

        summary.printf(
                "files=%d, ops=%d, elapsed=%.2fs, throughput=%.0f ops/s, errors=%d, versions=%d, hottest=%.1f%%%n",
                report.files(), all.size(), report.elapsedSeconds(),
                all.size() / Math.max(report.elapsedSeconds(), 1e-9),
                report.errors(), report.totalVersions(), report.hottestShare() * 100
        );

        Map<Op, List<Double>> byOp = new EnumMap<>(Op.class);
        for (Sample s : all) {
            if (s.ok()) {
                byOp.computeIfAbsent(s.op(), o -> new ArrayList<>()).add(s.latencyMicros());
            }
        }
        for (var e : byOp.entrySet()) {
            List<Double> lat = e.getValue();
            Collections.sort(lat);
            summary.printf("  %-13s n=%d p50=%.2fus p95=%.2fus p99=%.2fus%n",
                    e.getKey(), lat.size(), percentile(lat, 0.50), percentile(lat, 0.95), percentile(lat, 0.99));
        }

        // CSV to stdout.
        csv.println("op,success,latency_us");
        for (Sample s : all) {
            csv.printf("%s,%s,%.3f%n", s.op(), s.ok() ? "1" : "0", s.latencyMicros());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
