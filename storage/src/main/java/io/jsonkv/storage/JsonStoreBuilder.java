// file: src/main/java/io/jsonkv/storage/JsonStoreBuilder.java
package io.jsonkv.storage;

import io.jsonkv.storage.backend.MapBackend;
import io.jsonkv.storage.backend.ShardedMapBackend;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assembles a JsonStore and its background worker.
 * <p>
 * Defaults: caller-driven policy, compact JSON, ShardedMapBackend.
 * A custom serializer replaces the JSON one, so pretty() has no effect with it.
 * Values are deep-copied through Jackson unless copier() says otherwise.
 * <p>
 * build():
 *  - validates the path and creates a missing parent directory,
 *  - loads the existing file (missing or empty file = empty store),
 *  - copies the loaded entries into a fresh backend,
 *  - under BackgroundInterval starts a worker bound to the store's flush().
 */
public final class JsonStoreBuilder<K, V> {
    private static final Logger log = Logger.getLogger(JsonStoreBuilder.class.getName());

    private final Path path;
    private final Class<K> keyType;
    private final Class<V> valueType;

    private FlushPolicy policy = FlushPolicy.callerDriven();
    private boolean pretty = false;
    private Supplier<? extends MapBackend<K, V>> backendFactory = ShardedMapBackend::new;
    private Serializer<K, V> serializer; // null = JsonSerializer(keyType, valueType, pretty)
    private ValueCopier<V> copier;       // null = Jackson copy bound to valueType

    JsonStoreBuilder(Path path, Class<K> keyType, Class<V> valueType) {
        if (path == null) {
            throw new StoreException.ConfigException("store path must not be null");
        }
        this.path = path;
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    public JsonStoreBuilder<K, V> policy(FlushPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
        return this;
    }

    public JsonStoreBuilder<K, V> pretty(boolean pretty) {
        this.pretty = pretty;
        return this;
    }

    public JsonStoreBuilder<K, V> backend(Supplier<? extends MapBackend<K, V>> backendFactory) {
        this.backendFactory = Objects.requireNonNull(backendFactory, "backendFactory");
        return this;
    }

    public JsonStoreBuilder<K, V> serializer(Serializer<K, V> serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        return this;
    }

    /** Replace the default Jackson deep copy, e.g. ValueCopier.identity() for immutable values. */
    public JsonStoreBuilder<K, V> copier(ValueCopier<V> copier) {
        this.copier = Objects.requireNonNull(copier, "copier");
        return this;
    }

    /** Apply policy and pretty from a config. The path stays the one given to builder(). */
    public JsonStoreBuilder<K, V> config(StoreConfig config) {
        Objects.requireNonNull(config, "config");
        this.policy = config.flushPolicy();
        this.pretty = config.pretty();
        return this;
    }

    public JsonStoreHandle<K, V> build() {
        validatePath();

        JsonSerializer<K, V> json = new JsonSerializer<>(keyType, valueType, pretty);
        Serializer<K, V> ser = serializer != null ? serializer : json;
        ValueCopier<V> cop = copier != null ? copier : json;
        MapBackend<K, V> backend = backendFactory.get();
        if (backend == null) {
            throw new StoreException.ConfigException("backend factory returned null");
        }

        Map<K, V> loaded = Persistence.load(path, ser);
        for (Map.Entry<K, V> e : loaded.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                throw new StoreException.DeserializeException(
                        "null key or value in " + path + " (key=" + e.getKey() + ")");
            }
            backend.insert(e.getKey(), e.getValue());
        }

        AsyncFlushWorker worker = null;
        JsonStore<K, V> store;
        if (policy instanceof FlushPolicy.BackgroundInterval background) {
            FlushSignal trigger = new FlushSignal();
            store = new JsonStore<>(backend, path, ser, cop, policy, trigger::nudge);
            worker = AsyncFlushWorker.startWithSignal(
                    "jsonkv-flush-" + path.getFileName(), background.interval(), store::flush, trigger);
        } else {
            store = new JsonStore<>(backend, path, ser, cop, policy, null);
        }

        log.log(Level.INFO, "opened {0} with {1} entries (policy={2})",
                new Object[]{path, loaded.size(), policy.name()});
        return new JsonStoreHandle<>(store, worker);
    }

    // ---------- internals ----------

    private void validatePath() {
        if (Files.isDirectory(path)) {
            throw new StoreException.ConfigException("store path is a directory: " + path);
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        if (Files.exists(parent) && !Files.isDirectory(parent)) {
            throw new StoreException.ConfigException("parent of store path is not a directory: " + parent);
        }
        if (!Files.exists(parent)) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StoreException.StorageIoException("failed to create directory " + parent, e);
            }
        }
    }

    @Override
    public String toString() {
        return "JsonStoreBuilder{path=" + path +
                ", policy=" + policy +
                ", pretty=" + pretty +
                ", serializer=" + (serializer == null ? "json" : serializer) +
                "}";
    }
}
