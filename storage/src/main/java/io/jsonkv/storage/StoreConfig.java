// file: src/main/java/io/jsonkv/storage/StoreConfig.java
package io.jsonkv.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonkv.storage.dto.JsonStoreConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for opening a store, usually read from a small JSON file:
 * <pre>
 * { "path": "data/db.json", "policy": "background-interval", "flushIntervalMillis": 5000, "pretty": true }
 * </pre>
 * Only "path" is required. A relative path is resolved against the directory
 * holding the config file. Bad content is a ConfigException; a file that
 * cannot be read at all is a StorageIoException.
 */
public record StoreConfig(
        Path path,
        String policyName,
        Duration flushInterval,
        boolean pretty
) {
    public static final String DEFAULT_POLICY = "caller-driven";
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(5);

    public StoreConfig {
        if (path == null) throw new StoreException.ConfigException("path is required");
        if (policyName == null || policyName.isBlank()) policyName = DEFAULT_POLICY;
        if (flushInterval == null) flushInterval = DEFAULT_FLUSH_INTERVAL;
        // fail on open-time typos rather than at build()
        FlushPolicy.parse(policyName, flushInterval);
    }

    public static StoreConfig defaults(Path path) {
        return new StoreConfig(path, DEFAULT_POLICY, DEFAULT_FLUSH_INTERVAL, false);
    }

    public FlushPolicy flushPolicy() {
        return FlushPolicy.parse(policyName, flushInterval);
    }

    public static StoreConfig fromJsonFile(Path file) {
        ObjectMapper mapper = new ObjectMapper();
        JsonStoreConfig cfg;
        try {
            cfg = mapper.readValue(file.toFile(), JsonStoreConfig.class);
        } catch (JsonProcessingException e) {
            throw new StoreException.ConfigException("Invalid StoreConfig in " + file, e);
        } catch (IOException e) {
            throw new StoreException.StorageIoException("Failed to read StoreConfig from " + file, e);
        }
        if (cfg == null || cfg.path == null || cfg.path.isBlank()) {
            throw new StoreException.ConfigException("Missing \"path\" in " + file);
        }

        Path dataPath = Path.of(cfg.path);
        if (!dataPath.isAbsolute()) {
            Path dir = file.toAbsolutePath().getParent();
            dataPath = dir.resolve(dataPath);
        }
        Duration interval = cfg.flushIntervalMillis == null
                ? DEFAULT_FLUSH_INTERVAL
                : Duration.ofMillis(cfg.flushIntervalMillis);

        return new StoreConfig(
                dataPath,
                cfg.policy,
                interval,
                cfg.pretty != null && cfg.pretty
        );
    }
}
