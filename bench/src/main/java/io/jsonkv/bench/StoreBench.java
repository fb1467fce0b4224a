// file: bench/src/main/java/io/jsonkv/bench/StoreBench.java
package io.jsonkv.bench;

import io.jsonkv.storage.FlushStats;
import io.jsonkv.storage.JsonStore;
import io.jsonkv.storage.JsonStoreHandle;
import io.jsonkv.storage.backend.ConcurrentMapBackend;
import io.jsonkv.storage.backend.LockedMapBackend;
import io.jsonkv.storage.backend.MapBackend;
import io.jsonkv.storage.backend.ShardedMapBackend;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process workload driver for a JSON store: N threads, Zipfian keys, a
 * fixed write ratio, for a fixed duration, under a chosen policy and backend.
 *
 * Usage:
 *   java -cp ... io.jsonkv.bench.StoreBench \
 *     --file bench.json \
 *     --threads 8 \
 *     --duration-seconds 30 \
 *     --keyspace 100000 \
 *     --value-bytes 512 \
 *     --write-ratio 0.5 \
 *     --zipf-skew 0.99 \
 *     --policy background-interval \
 *     --interval-millis 1000 \
 *     --backend sharded
 *
 * Output:
 *   - Summary line to stderr.
 *   - CSV to stdout with per-op latency samples:
 *       op,success,latency_ms
 */
public final class StoreBench {
    private static final Logger log = Logger.getLogger(StoreBench.class.getName());

    record Sample(String op, boolean ok, double latencyMs) {
    }

    record Result(List<Sample> samples, long totalOps, long failedOps, FlushStats flushStats, int finalSize) {
    }

    private StoreBench() {
    }

    public static void main(String[] args) throws Exception {
        BenchSettings settings = BenchSettings.fromArgs(args);
        Result result = run(settings);
        summarizeAndPrint(result, settings, System.err, System.out);
    }

    static Result run(BenchSettings s) throws InterruptedException {
        byte[] raw = new byte[s.valueBytes()];
        Arrays.fill(raw, (byte) 'x');
        String value = new String(raw, StandardCharsets.US_ASCII);

        ZipfianKeyGenerator zipf = new ZipfianKeyGenerator(s.keyspace(), s.zipfSkew());
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicBoolean failureLogged = new AtomicBoolean(false);

        try (JsonStoreHandle<String, String> db = JsonStore.builder(s.file(), String.class, String.class)
                .policy(s.policy())
                .backend(backendFactory(s.backend()))
                .build()) {

            long endTime = System.nanoTime() + s.duration().toNanos();
            ExecutorService exec = Executors.newFixedThreadPool(s.threads());
            for (int t = 0; t < s.threads(); t++) {
                Random rnd = new Random(42L + t);
                exec.submit(() -> {
                    while (System.nanoTime() < endTime) {
                        boolean isWrite = rnd.nextDouble() < s.writeRatio();
                        String key = "key-" + zipf.nextKey(rnd);
                        String op = isWrite ? "PUT" : "GET";

                        long start = System.nanoTime();
                        boolean ok;
                        try {
                            if (isWrite) {
                                db.insert(key, value);
                            } else {
                                db.get(key);
                            }
                            ok = true;
                        } catch (RuntimeException e) {
                            ok = false;
                            if (failureLogged.compareAndSet(false, true)) {
                                log.log(Level.WARNING, op + " failed, further failures are only counted", e);
                            }
                        }
                        samples.add(new Sample(op, ok, (System.nanoTime() - start) / 1_000_000.0));
                    }
                });
            }
            exec.shutdown();
            if (!exec.awaitTermination(s.duration().toMillis() + 5_000L, TimeUnit.MILLISECONDS)) {
                exec.shutdownNow();
            }

            db.flush();
            List<Sample> all = new ArrayList<>(samples.size());
            samples.drainTo(all);
            long failed = all.stream().filter(x -> !x.ok()).count();
            return new Result(all, all.size(), failed, db.flushStats(), db.size());
        }
    }

    static Supplier<MapBackend<String, String>> backendFactory(String name) {
        return switch (name) {
            case "sharded" -> ShardedMapBackend::new;
            case "concurrent" -> ConcurrentMapBackend::new;
            case "locked" -> LockedMapBackend::new;
            default -> throw new IllegalArgumentException("unknown backend: " + name);
        };
    }

    static void summarizeAndPrint(Result r, BenchSettings s, PrintStream summary, PrintStream csv) {
        if (r.samples().isEmpty()) {
            summary.println("no samples collected");
            return;
        }

        double seconds = s.duration().toNanos() / 1e9;
        double throughput = r.totalOps() / seconds;

        List<Double> latencies = new ArrayList<>(r.samples().size());
        for (Sample x : r.samples()) {
            if (x.ok()) {
                latencies.add(x.latencyMs());
            }
        }
        Collections.sort(latencies);

        summary.printf(
                "policy=%s, backend=%s, throughput=%.2f ops/s, ok=%d, err=%d, p50=%.3fms, p95=%.3fms, p99=%.3fms, flushes=%d, flush_failures=%d, keys=%d%n",
                s.policy().name(), s.backend(), throughput,
                r.totalOps() - r.failedOps(), r.failedOps(),
                percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99),
                r.flushStats().completed(), r.flushStats().failed(), r.finalSize()
        );

        csv.println("op,success,latency_ms");
        for (Sample x : r.samples()) {
            csv.printf("%s,%s,%.3f%n", x.op(), x.ok() ? "1" : "0", x.latencyMs());
        }
    }

    /** Linear interpolation between closest ranks; NaN for an empty list. */
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
