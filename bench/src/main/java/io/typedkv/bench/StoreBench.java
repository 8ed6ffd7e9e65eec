// file: bench/src/main/java/io/typedkv/bench/StoreBench.java
package io.typedkv.bench;

import io.typedkv.core.merge.Int64AddMergeOperator;
import io.typedkv.storage.KeyValueAccessor;
import io.typedkv.storage.MergeAccessor;
import io.typedkv.storage.MergeableStore;
import io.typedkv.storage.StoreBuilder;
import io.typedkv.storage.StoreContext;
import io.typedkv.storage.TypedStore;
import io.typedkv.storage.config.EngineKind;
import io.typedkv.storage.config.StoreOptions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process workload driver for typed and mergeable stores.
 *
 * Usage:
 *   java -cp bench.jar io.typedkv.bench.StoreBench \
 *     --engine rocksdb \
 *     --path /tmp/typedkv-bench \
 *     --threads 8 \
 *     --duration-seconds 30 \
 *     --keyspace 100000 \
 *     --value-bytes 512 \
 *     --write-ratio 0.4 \
 *     --merge-ratio 0.2 \
 *     --zipf-skew 0.99
 *
 * Each operation is a MERGE (counter +1) with probability merge-ratio, a PUT
 * with probability write-ratio, and a GET otherwise.
 *
 * Output:
 *   - Summary line per op to stderr.
 *   - CSV to stdout with per-op latency samples:
 *       op,success,latency_us
 */
public final class StoreBench {
    private static final Logger log = Logger.getLogger(StoreBench.class.getName());

    static final class BlobStore extends TypedStore<String, byte[]> {
        BlobStore(KeyValueAccessor<String, byte[]> accessor) {
            super(accessor);
        }
    }

    static final class CounterStore extends MergeableStore<String, Long, Long> {
        CounterStore(MergeAccessor<String, Long, Long> accessor) {
            super(accessor);
        }

        void increment(String key) {
            merge(key, 1L);
        }
    }

    private record Sample(String op, boolean ok, double latencyUs) {}

    private StoreBench() {
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        EngineKind engine = EngineKind.valueOf(cfg.getOrDefault("engine", "rocksdb").toUpperCase(Locale.ROOT));
        Path path = cfg.containsKey("path") ? Path.of(cfg.get("path")) : Files.createTempDirectory("typedkv-bench");
        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int durationSeconds = Integer.parseInt(cfg.getOrDefault("duration-seconds", "30"));
        int keyspace = Integer.parseInt(cfg.getOrDefault("keyspace", "100000"));
        int valueBytes = Integer.parseInt(cfg.getOrDefault("value-bytes", "512"));
        double writeRatio = Double.parseDouble(cfg.getOrDefault("write-ratio", "0.4"));
        double mergeRatio = Double.parseDouble(cfg.getOrDefault("merge-ratio", "0.2"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));

        if (writeRatio < 0 || mergeRatio < 0 || writeRatio + mergeRatio > 1.0) {
            throw new IllegalArgumentException("write-ratio and merge-ratio must be >= 0 and sum to at most 1");
        }

        StoreOptions options = StoreOptions.defaults(path)
                .withEngine(engine)
                .withDeleteExistingDatabaseOnStartup(true);

        try (StoreContext ctx = new StoreBuilder(options)
                .addStore("blobs", String.class, byte[].class, BlobStore::new)
                .addMergeableStore("counters", String.class, Long.class, Long.class,
                        new Int64AddMergeOperator(), CounterStore::new)
                .open()) {
            runBenchmark(ctx.getStore(BlobStore.class), ctx.getStore(CounterStore.class),
                    threads, durationSeconds, keyspace, valueBytes, writeRatio, mergeRatio, zipfSkew);
        }
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("missing value for " + a);
            }
            out.put(a.substring(2), args[++i]);
        }
        return out;
    }

    private static void runBenchmark(
            BlobStore blobs,
            CounterStore counters,
            int threads,
            int durationSeconds,
            int keyspace,
            int valueBytes,
            double writeRatio,
            double mergeRatio,
            double zipfSkew
    ) throws InterruptedException {
        byte[] value = new byte[valueBytes];
        Arrays.fill(value, (byte) 'x');

        SkewedKeys keys = new SkewedKeys(keyspace, zipfSkew);
        ExecutorService exec = Executors.newFixedThreadPool(threads);
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicLong opCount = new AtomicLong();
        long endTime = System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds);

        Runnable worker = () -> {
            ThreadLocalRandom rnd = ThreadLocalRandom.current();
            while (System.nanoTime() < endTime) {
                double roll = rnd.nextDouble();
                String key = "key-" + keys.next(rnd);
                String op = roll < mergeRatio ? "MERGE" : roll < mergeRatio + writeRatio ? "PUT" : "GET";

                long start = System.nanoTime();
                boolean ok = false;
                try {
                    switch (op) {
                        case "MERGE" -> counters.increment(key);
                        case "PUT" -> blobs.put(key, value);
                        default -> blobs.get(key);
                    }
                    ok = true;
                } catch (RuntimeException e) {
                    log.log(Level.FINE, op + " failed for " + key, e);
                } finally {
                    samples.add(new Sample(op, ok, (System.nanoTime() - start) / 1_000.0));
                    opCount.incrementAndGet();
                }
            }
        };

        for (int i = 0; i < threads; i++) {
            exec.submit(worker);
        }
        exec.shutdown();
        exec.awaitTermination(durationSeconds + 5L, TimeUnit.SECONDS);

        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);
        summarizeAndPrint(all, opCount.get(), durationSeconds);
    }

    private static void summarizeAndPrint(List<Sample> all, long totalOps, int durationSeconds) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        System.err.printf("throughput=%.2f ops/s%n", totalOps / (double) durationSeconds);
        for (String op : List.of("GET", "PUT", "MERGE")) {
            List<Double> latencies = new ArrayList<>();
            long errors = 0;
            for (Sample s : all) {
                if (!s.op().equals(op)) continue;
                if (s.ok()) latencies.add(s.latencyUs()); else errors++;
            }
            if (latencies.isEmpty() && errors == 0) continue;
            Collections.sort(latencies);
            System.err.printf("%-5s ok=%d, err=%d, p50=%.1fus, p95=%.1fus, p99=%.1fus%n",
                    op, latencies.size(), errors,
                    percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99));
        }

        System.out.println("op,success,latency_us");
        for (Sample s : all) {
            System.out.printf("%s,%s,%.1f%n", s.op(), s.ok() ? "1" : "0", s.latencyUs());
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
