package io.jsonkv.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @TempDir Path dir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        outBytes.reset();
        errBytes.reset();
        return Cli.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void put_then_get_across_invocations() {
        String file = dir.resolve("db.json").toString();

        assertEquals(0, run("--file", file, "put", "greeting", "hello"));
        assertEquals("OK" + System.lineSeparator(), out());

        assertEquals(0, run("--file", file, "get", "greeting"));
        assertEquals("hello" + System.lineSeparator(), out());
    }

    @Test
    void missing_key_prints_not_found_and_exits_zero() {
        String file = dir.resolve("db.json").toString();
        assertEquals(0, run("--file", file, "get", "nope"));
        assertTrue(out().contains("(not found)"));

        assertEquals(0, run("--file", file, "del", "nope"));
        assertTrue(out().contains("(not found)"));
    }

    @Test
    void list_keys_count_and_clear() {
        String file = dir.resolve("db.json").toString();
        run("--file", file, "put", "b", "2");
        run("--file", file, "put", "a", "1");

        assertEquals(0, run("--file", file, "list"));
        String nl = System.lineSeparator();
        assertEquals("a=1" + nl + "b=2" + nl, out());

        assertEquals(0, run("--file", file, "keys"));
        assertEquals("a" + nl + "b" + nl, out());

        assertEquals(0, run("--file", file, "count"));
        assertEquals("2" + nl, out());

        assertEquals(0, run("--file", file, "clear"));
        run("--file", file, "count");
        assertEquals("0" + nl, out());
    }

    @Test
    void del_removes_from_file() throws Exception {
        Path file = dir.resolve("db.json");
        run("--file", file.toString(), "put", "k", "v");
        assertEquals(0, run("--file", file.toString(), "del", "k"));
        assertEquals("{}", Files.readString(file));
    }

    @Test
    void pretty_flag_writes_indented_json() throws Exception {
        Path file = dir.resolve("db.json");
        assertEquals(0, run("--file", file.toString(), "--pretty", "put", "k", "v"));
        assertTrue(Files.readString(file).contains("\n"));
    }

    @Test
    void config_file_supplies_the_path() throws Exception {
        Path cfg = Files.writeString(dir.resolve("store.json"), "{ \"path\": \"from-config.json\" }");
        assertEquals(0, run("--config", cfg.toString(), "put", "k", "v"));
        assertTrue(Files.exists(dir.resolve("from-config.json")));
    }

    @Test
    void usage_errors_exit_one() {
        assertEquals(1, run());
        assertTrue(err().contains("missing command"));

        assertEquals(1, run("--file", dir.resolve("db.json").toString(), "put", "only-key"));
        assertTrue(err().contains("put requires <key> <value>"));

        assertEquals(1, run("frobnicate"));
        assertTrue(err().contains("unknown command"));

        assertEquals(1, run("--file"));
        assertTrue(err().contains("--file requires a value"));

        assertEquals(1, run("--verbose", "count"));
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void store_failures_exit_two() throws Exception {
        Path file = Files.writeString(dir.resolve("broken.json"), "{not json");
        assertEquals(2, run("--file", file.toString(), "count"));
        assertTrue(err().startsWith("error: "));

        assertEquals(2, run("--file", dir.toString(), "count"));
    }
}
