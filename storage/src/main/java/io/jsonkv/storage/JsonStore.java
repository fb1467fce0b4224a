// file: src/main/java/io/jsonkv/storage/JsonStore.java
package io.jsonkv.storage;

import io.jsonkv.storage.backend.MapBackend;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory key-value store mirrored to a JSON file.
 * <p>
 * Responsibilities:
 *  - Hold the live map in a MapBackend; the backend is the source of truth.
 *  - After every mutation ask the FlushPolicy what to do:
 *      * FLUSH_NOW:    snapshot + encode + atomic write on the caller's thread,
 *      * NUDGE_WORKER: poke the background worker (a FlushSignal nudge),
 *      * NONE:         wait for an explicit flush().
 *  - flush(): snapshot the backend, encode, and write via Persistence.atomicWrite().
 *  - Never share a value instance with a caller: values are copied with the
 *    ValueCopier on the way in and on the way out. A caller mutating what it
 *    passed in or got back cannot change the map without a flush decision.
 * <p>
 * Concurrency:
 *  - No lock is taken around backend calls; callers get exactly the backend's
 *    guarantees.
 *  - Each flush draws a sequence number and takes its snapshot under
 *    snapshotLock, so higher numbers always hold newer snapshots. Encoding
 *    runs unlocked. File writes are serialized by writeLock; a flush whose
 *    number is lower than the last one written skips its write, so the file
 *    never goes back to an older snapshot.
 * <p>
 * Instances come from JsonStore.builder() / open() wrapped in a JsonStoreHandle,
 * which owns the background worker.
 */
public final class JsonStore<K, V> implements KeyValueStore<K, V> {
    private static final Logger log = Logger.getLogger(JsonStore.class.getName());

    private final MapBackend<K, V> map;
    private final Path path;
    private final Serializer<K, V> serializer;
    private final ValueCopier<V> copier;
    private final FlushPolicy policy;
    private final Runnable nudge; // null unless policy is BackgroundInterval

    private final ReentrantLock snapshotLock = new ReentrantLock();
    private final ReentrantLock writeLock = new ReentrantLock();
    private long flushSequence; // guarded by snapshotLock
    private long lastWrittenSequence; // guarded by writeLock

    private final AtomicLong completedFlushes = new AtomicLong();
    private final AtomicLong failedFlushes = new AtomicLong();

    JsonStore(MapBackend<K, V> map, Path path, Serializer<K, V> serializer, ValueCopier<V> copier,
              FlushPolicy policy, Runnable nudge) {
        this.map = Objects.requireNonNull(map, "map");
        this.path = Objects.requireNonNull(path, "path");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.copier = Objects.requireNonNull(copier, "copier");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.nudge = nudge;
    }

    // ---------- entry points ----------

    /** Open (or create) a store with the caller-driven policy and compact JSON. */
    public static <K, V> JsonStoreHandle<K, V> open(Path path, Class<K> keyType, Class<V> valueType) {
        return builder(path, keyType, valueType).build();
    }

    /** Open (or create) a store with the given policy. */
    public static <K, V> JsonStoreHandle<K, V> open(Path path, Class<K> keyType, Class<V> valueType, FlushPolicy policy) {
        return builder(path, keyType, valueType).policy(policy).build();
    }

    public static <K, V> JsonStoreBuilder<K, V> builder(Path path, Class<K> keyType, Class<V> valueType) {
        return new JsonStoreBuilder<>(path, keyType, valueType);
    }

    /** Builder preloaded with a StoreConfig (path, policy, pretty). */
    public static <K, V> JsonStoreBuilder<K, V> builder(StoreConfig config, Class<K> keyType, Class<V> valueType) {
        Objects.requireNonNull(config, "config");
        return new JsonStoreBuilder<>(config.path(), keyType, valueType).config(config);
    }

    // ---------- reads ----------

    @Override
    public V get(K key) {
        return copier.copy(map.get(key));
    }

    @Override
    public boolean containsKey(K key) {
        return map.containsKey(key);
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public List<Map.Entry<K, V>> entries() {
        List<Map.Entry<K, V>> snapshot = map.snapshot();
        List<Map.Entry<K, V>> entries = new ArrayList<>(snapshot.size());
        for (Map.Entry<K, V> e : snapshot) {
            entries.add(Map.entry(e.getKey(), copier.copy(e.getValue())));
        }
        return entries;
    }

    @Override
    public List<K> keys() {
        List<Map.Entry<K, V>> snapshot = map.snapshot();
        List<K> keys = new ArrayList<>(snapshot.size());
        for (Map.Entry<K, V> e : snapshot) {
            keys.add(e.getKey());
        }
        return keys;
    }

    @Override
    public List<V> values() {
        List<Map.Entry<K, V>> snapshot = map.snapshot();
        List<V> values = new ArrayList<>(snapshot.size());
        for (Map.Entry<K, V> e : snapshot) {
            values.add(copier.copy(e.getValue()));
        }
        return values;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public FlushPolicy policy() {
        return policy;
    }

    @Override
    public FlushStats flushStats() {
        return new FlushStats(completedFlushes.get(), failedFlushes.get());
    }

    // ---------- writes ----------

    @Override
    public V insert(K key, V value) {
        V previous = map.insert(key, copier.copy(value));
        afterMutation();
        return previous;
    }

    @Override
    public V remove(K key) {
        V removed = map.remove(key);
        afterMutation();
        return removed;
    }

    @Override
    public void clear() {
        map.clear();
        afterMutation();
    }

    @Override
    public void extend(Map<? extends K, ? extends V> entries) {
        Objects.requireNonNull(entries, "entries");
        extend(entries.entrySet());
    }

    @Override
    public void extend(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries");
        for (Map.Entry<? extends K, ? extends V> e : entries) {
            map.insert(e.getKey(), copier.copy(e.getValue()));
        }
        afterMutation();
    }

    @Override
    public boolean update(K key, UnaryOperator<V> mutator) {
        Objects.requireNonNull(mutator, "mutator");
        V current = map.get(key);
        if (current == null) {
            return false;
        }
        map.insert(key, copier.copy(mutator.apply(copier.copy(current))));
        afterMutation();
        return true;
    }

    @Override
    public V getOrInsert(K key, V defaultValue) {
        V existing = map.get(key);
        if (existing != null) {
            return copier.copy(existing);
        }
        map.insert(key, copier.copy(defaultValue));
        afterMutation();
        return defaultValue;
    }

    @Override
    public V getOrInsertWith(K key, Supplier<? extends V> defaultSupplier) {
        Objects.requireNonNull(defaultSupplier, "defaultSupplier");
        V existing = map.get(key);
        if (existing != null) {
            return copier.copy(existing);
        }
        V value = defaultSupplier.get();
        map.insert(key, copier.copy(value));
        afterMutation();
        return value;
    }

    // ---------- persistence ----------

    @Override
    public void flush() {
        try {
            long sequence;
            List<Map.Entry<K, V>> entries;
            snapshotLock.lock();
            try {
                sequence = ++flushSequence;
                entries = map.snapshot();
            } finally {
                snapshotLock.unlock();
            }

            Map<K, V> snapshot = new HashMap<>();
            for (Map.Entry<K, V> e : entries) {
                snapshot.put(e.getKey(), e.getValue());
            }
            byte[] bytes = serializer.encode(snapshot);

            writeLock.lock();
            try {
                if (sequence < lastWrittenSequence) {
                    log.log(Level.FINE, "skipping flush #{0} of {1}, a newer snapshot is already on disk",
                            new Object[]{sequence, path});
                } else {
                    Persistence.atomicWrite(path, bytes);
                    lastWrittenSequence = sequence;
                    log.log(Level.FINE, "flushed {0} entries ({1} bytes) to {2}",
                            new Object[]{snapshot.size(), bytes.length, path});
                }
            } finally {
                writeLock.unlock();
            }
            completedFlushes.incrementAndGet();
        } catch (RuntimeException e) {
            failedFlushes.incrementAndGet();
            throw e;
        }
    }

    // ---------- internals ----------

    private void afterMutation() {
        switch (policy.onMutation()) {
            case FLUSH_NOW -> flush();
            case NUDGE_WORKER -> {
                if (nudge != null) {
                    nudge.run();
                }
            }
            case NONE -> {
                // caller flushes explicitly
            }
        }
    }

    @Override
    public String toString() {
        return "JsonStore{path=" + path + ", policy=" + policy + "}";
    }
}
