package io.jsonkv.bench;

import io.jsonkv.storage.FlushPolicy;
import io.jsonkv.storage.JsonStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoreBenchTest {

    @TempDir Path dir;

    @Test
    void args_are_parsed_with_defaults() {
        var s = BenchSettings.fromArgs(new String[]{
                "--file", dir.resolve("b.json").toString(),
                "--threads", "2",
                "--policy", "write-through",
                "--backend", "LOCKED"
        });
        assertEquals(2, s.threads());
        assertEquals(FlushPolicy.writeThrough(), s.policy());
        assertEquals("locked", s.backend());
        assertEquals(Duration.ofSeconds(30), s.duration());
        assertEquals(0.5, s.writeRatio());
    }

    @Test
    void bad_args_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> BenchSettings.fromArgs(new String[]{"--threads"}));
        assertThrows(IllegalArgumentException.class, () -> BenchSettings.fromArgs(new String[]{"--base-url", "x"}));
        assertThrows(IllegalArgumentException.class, () -> BenchSettings.fromArgs(new String[]{"--write-ratio", "1.5"}));
        assertThrows(IllegalArgumentException.class, () -> BenchSettings.fromArgs(new String[]{"--backend", "btree"}));
        assertThrows(IllegalArgumentException.class, () -> BenchSettings.fromArgs(new String[]{"stray"}));
    }

    @Test
    void short_run_writes_the_final_state_to_disk() throws Exception {
        Path file = dir.resolve("bench.json");
        var settings = new BenchSettings(file, 2, Duration.ofMillis(200), 100, 16, 0.5, 0.99,
                FlushPolicy.backgroundInterval(Duration.ofMillis(50)), "concurrent");

        StoreBench.Result result = StoreBench.run(settings);

        assertTrue(result.totalOps() > 0);
        assertEquals(0, result.failedOps());
        assertTrue(result.flushStats().completed() >= 1);
        try (var db = JsonStore.open(file, String.class, String.class)) {
            assertEquals(result.finalSize(), db.size());
        }

        var err = new ByteArrayOutputStream();
        var out = new ByteArrayOutputStream();
        StoreBench.summarizeAndPrint(result, settings,
                new PrintStream(err, true, StandardCharsets.UTF_8), new PrintStream(out, true, StandardCharsets.UTF_8));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("policy=background-interval"));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("op,success,latency_ms"));
    }

    @Test
    void percentile_interpolates() {
        List<Double> sorted = List.of(1.0, 2.0, 3.0, 4.0, 5.0);
        assertEquals(3.0, StoreBench.percentile(sorted, 0.5));
        assertEquals(1.0, StoreBench.percentile(sorted, 0.0));
        assertEquals(4.6, StoreBench.percentile(sorted, 0.9), 1e-9);
        assertTrue(Double.isNaN(StoreBench.percentile(List.of(), 0.5)));
    }
}
