package io.jsonkv.bench;

import io.jsonkv.storage.FlushPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed command line of StoreBench. Unknown flags and out-of-range values are
 * rejected with IllegalArgumentException.
 */
public record BenchSettings(
        Path file,
        int threads,
        Duration duration,
        int keyspace,
        int valueBytes,
        double writeRatio,
        double zipfSkew,
        FlushPolicy policy,
        String backend
) {
    static final Set<String> BACKENDS = Set.of("sharded", "concurrent", "locked");
    private static final Set<String> FLAGS = Set.of(
            "file", "threads", "duration-seconds", "keyspace", "value-bytes",
            "write-ratio", "zipf-skew", "policy", "interval-millis", "backend");

    public BenchSettings {
        if (file == null) throw new IllegalArgumentException("file is required");
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be positive");
        }
        if (keyspace <= 0) throw new IllegalArgumentException("keyspace must be > 0");
        if (valueBytes < 0) throw new IllegalArgumentException("value-bytes must be >= 0");
        if (writeRatio < 0.0 || writeRatio > 1.0) throw new IllegalArgumentException("write-ratio must be in [0, 1]");
        if (policy == null) throw new IllegalArgumentException("policy is required");
        if (backend == null || !BACKENDS.contains(backend)) {
            throw new IllegalArgumentException("backend must be one of " + BACKENDS + ", got: " + backend);
        }
    }

    public static BenchSettings fromArgs(String[] args) {
        Map<String, String> cfg = parseArgs(args);

        Duration interval = Duration.ofMillis(Long.parseLong(cfg.getOrDefault("interval-millis", "1000")));
        return new BenchSettings(
                Path.of(cfg.getOrDefault("file", "bench.json")),
                Integer.parseInt(cfg.getOrDefault("threads", "4")),
                Duration.ofSeconds(Long.parseLong(cfg.getOrDefault("duration-seconds", "30"))),
                Integer.parseInt(cfg.getOrDefault("keyspace", "100000")),
                Integer.parseInt(cfg.getOrDefault("value-bytes", "512")),
                Double.parseDouble(cfg.getOrDefault("write-ratio", "0.5")),
                Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99")),
                FlushPolicy.parse(cfg.getOrDefault("policy", "background-interval"), interval),
                cfg.getOrDefault("backend", "sharded").toLowerCase(Locale.ROOT)
        );
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
            String key = a.substring(2);
            if (!FLAGS.contains(key)) {
                throw new IllegalArgumentException("unknown flag: " + a);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("missing value for " + a);
            }
            out.put(key, args[++i]);
        }
        return out;
    }
}
