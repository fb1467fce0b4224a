// file: src/main/java/io/jsonkv/storage/JsonStoreHandle.java
package io.jsonkv.storage;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owner of an open store. Use with try-with-resources.
 * <p>
 * Semantics:
 *  - Every KeyValueStore operation delegates to the underlying JsonStore.
 *  - close() stops the background worker (if any) and waits for it. There is
 *    no implicit final flush: call flush() first if unflushed writes matter.
 *  - close() is idempotent. After it, operations throw IllegalStateException;
 *    path(), policy() and flushStats() stay readable.
 * <p>
 * Thread-safe; share one handle between threads.
 */
public final class JsonStoreHandle<K, V> implements KeyValueStore<K, V>, AutoCloseable {
    private static final Logger log = Logger.getLogger(JsonStoreHandle.class.getName());

    private final JsonStore<K, V> store;
    private final AsyncFlushWorker worker; // null unless BackgroundInterval
    private final AtomicBoolean closed = new AtomicBoolean(false);

    JsonStoreHandle(JsonStore<K, V> store, AsyncFlushWorker worker) {
        this.store = store;
        this.worker = worker;
    }

    @Override
    public V get(K key) {
        ensureOpen();
        return store.get(key);
    }

    @Override
    public boolean containsKey(K key) {
        ensureOpen();
        return store.containsKey(key);
    }

    @Override
    public int size() {
        ensureOpen();
        return store.size();
    }

    @Override
    public boolean isEmpty() {
        ensureOpen();
        return store.isEmpty();
    }

    @Override
    public List<Map.Entry<K, V>> entries() {
        ensureOpen();
        return store.entries();
    }

    @Override
    public List<K> keys() {
        ensureOpen();
        return store.keys();
    }

    @Override
    public List<V> values() {
        ensureOpen();
        return store.values();
    }

    @Override
    public Path path() {
        return store.path();
    }

    @Override
    public FlushPolicy policy() {
        return store.policy();
    }

    @Override
    public FlushStats flushStats() {
        return store.flushStats();
    }

    @Override
    public V insert(K key, V value) {
        ensureOpen();
        return store.insert(key, value);
    }

    @Override
    public V remove(K key) {
        ensureOpen();
        return store.remove(key);
    }

    @Override
    public void clear() {
        ensureOpen();
        store.clear();
    }

    @Override
    public void extend(Map<? extends K, ? extends V> entries) {
        ensureOpen();
        store.extend(entries);
    }

    @Override
    public void extend(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        ensureOpen();
        store.extend(entries);
    }

    @Override
    public boolean update(K key, UnaryOperator<V> mutator) {
        ensureOpen();
        return store.update(key, mutator);
    }

    @Override
    public V getOrInsert(K key, V defaultValue) {
        ensureOpen();
        return store.getOrInsert(key, defaultValue);
    }

    @Override
    public V getOrInsertWith(K key, Supplier<? extends V> defaultSupplier) {
        ensureOpen();
        return store.getOrInsertWith(key, defaultSupplier);
    }

    @Override
    public void flush() {
        ensureOpen();
        store.flush();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (worker != null) {
            worker.close();
        }
        log.log(Level.INFO, "closed {0}", store.path());
    }

    // package-private for tests
    AsyncFlushWorker worker() {
        return worker;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("store is closed: " + store.path());
        }
    }

    @Override
    public String toString() {
        return "JsonStoreHandle{" + store + ", closed=" + closed.get() + "}";
    }
}
