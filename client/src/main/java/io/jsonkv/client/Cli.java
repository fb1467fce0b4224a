// file: client/src/main/java/io/jsonkv/client/Cli.java
package io.jsonkv.client;

import io.jsonkv.storage.FlushPolicy;
import io.jsonkv.storage.JsonStore;
import io.jsonkv.storage.JsonStoreBuilder;
import io.jsonkv.storage.JsonStoreHandle;
import io.jsonkv.storage.StoreConfig;
import io.jsonkv.storage.StoreException;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line access to a JSON store file. Keys and values are strings.
 *
 * Usage:
 *   jsonkv-cli [--file path] [--pretty] [--config store.json] put <key> <value>
 *   jsonkv-cli [--file path] [--pretty] [--config store.json] get <key>
 *   jsonkv-cli [--file path] [--pretty] [--config store.json] del <key>
 *   jsonkv-cli [--file path] [--pretty] [--config store.json] list | keys | count | clear
 *
 * Mutating commands run with write-through so the file is current on exit.
 * Exit codes: 0 ok (also for a missing key), 1 usage error, 2 store failure.
 */
public final class Cli {

    static final String DEFAULT_FILE = "jsonkv.json";

    private static final String USAGE = """
            Usage:
              jsonkv-cli [--file path] [--pretty] [--config store.json] put <key> <value>
              jsonkv-cli [--file path] [--pretty] [--config store.json] get <key>
              jsonkv-cli [--file path] [--pretty] [--config store.json] del <key>
              jsonkv-cli [--file path] [--pretty] [--config store.json] list | keys | count | clear
            """;

    // strong reference, JUL only keeps loggers weakly
    private static final Logger storeLog = Logger.getLogger("io.jsonkv");

    private final PrintStream out;
    private final PrintStream err;

    private Cli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        // store open/close chatter would interleave with command output
        storeLog.setLevel(Level.WARNING);
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one command and returns the process exit code. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        Cli cli = new Cli(out, err);
        try {
            Options opts = Options.parse(args);
            cli.execute(opts);
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.print(USAGE);
            return 1;
        } catch (StoreException e) {
            err.println("error: " + e.getMessage());
            return 2;
        }
    }

    private void execute(Options opts) {
        String cmd = opts.command.get(0);
        List<String> rest = opts.command.subList(1, opts.command.size());

        switch (cmd) {
            case "put" -> {
                requireArgs(cmd, rest, 2, "<key> <value>");
                try (var db = open(opts, true)) {
                    db.insert(rest.get(0), rest.get(1));
                }
                out.println("OK");
            }
            case "get" -> {
                requireArgs(cmd, rest, 1, "<key>");
                try (var db = open(opts, false)) {
                    String value = db.get(rest.get(0));
                    out.println(value == null ? "(not found)" : value);
                }
            }
            case "del" -> {
                requireArgs(cmd, rest, 1, "<key>");
                try (var db = open(opts, true)) {
                    String removed = db.remove(rest.get(0));
                    out.println(removed == null ? "(not found)" : "OK");
                }
            }
            case "list" -> {
                requireArgs(cmd, rest, 0, "");
                try (var db = open(opts, false)) {
                    List<Map.Entry<String, String>> entries = new ArrayList<>(db.entries());
                    entries.sort(Map.Entry.comparingByKey());
                    for (Map.Entry<String, String> e : entries) {
                        out.println(e.getKey() + "=" + e.getValue());
                    }
                }
            }
            case "keys" -> {
                requireArgs(cmd, rest, 0, "");
                try (var db = open(opts, false)) {
                    List<String> keys = new ArrayList<>(db.keys());
                    keys.sort(null);
                    keys.forEach(out::println);
                }
            }
            case "count" -> {
                requireArgs(cmd, rest, 0, "");
                try (var db = open(opts, false)) {
                    out.println(db.size());
                }
            }
            case "clear" -> {
                requireArgs(cmd, rest, 0, "");
                try (var db = open(opts, true)) {
                    db.clear();
                }
                out.println("OK");
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    private JsonStoreHandle<String, String> open(Options opts, boolean mutating) {
        JsonStoreBuilder<String, String> builder;
        if (opts.config != null) {
            StoreConfig cfg = StoreConfig.fromJsonFile(opts.config);
            Path path = opts.file != null ? opts.file : cfg.path();
            builder = JsonStore.builder(path, String.class, String.class).config(cfg);
        } else {
            Path path = opts.file != null ? opts.file : Path.of(DEFAULT_FILE);
            builder = JsonStore.builder(path, String.class, String.class);
        }
        if (opts.pretty) {
            builder.pretty(true);
        }
        // one command per process: no background worker, no deferred writes
        builder.policy(mutating ? FlushPolicy.writeThrough() : FlushPolicy.callerDriven());
        return builder.build();
    }

    private static void requireArgs(String cmd, List<String> rest, int expected, String shape) {
        if (rest.size() != expected) {
            throw new CliException(expected == 0
                    ? cmd + " takes no arguments"
                    : cmd + " requires " + shape);
        }
    }

    // ---------- argument parsing ----------

    private static final class Options {
        Path file;
        Path config;
        boolean pretty;
        List<String> command;

        static Options parse(String[] args) {
            Options o = new Options();
            int i = 0;
            while (i < args.length && args[i].startsWith("--")) {
                String flag = args[i];
                switch (flag) {
                    case "--file" -> o.file = Path.of(valueOf(args, ++i, flag));
                    case "--config" -> o.config = Path.of(valueOf(args, ++i, flag));
                    case "--pretty" -> o.pretty = true;
                    default -> throw new CliException("unknown option: " + flag);
                }
                i++;
            }
            if (i >= args.length) {
                throw new CliException("missing command");
            }
            o.command = Arrays.asList(args).subList(i, args.length);
            return o;
        }

        private static String valueOf(String[] args, int i, String flag) {
            if (i >= args.length) {
                throw new CliException(flag + " requires a value");
            }
            return args[i];
        }
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
