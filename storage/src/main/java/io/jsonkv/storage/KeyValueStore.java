// file: src/main/java/io/jsonkv/storage/KeyValueStore.java
package io.jsonkv.storage;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Operations of a persistent key-value store.
 * <p>
 * Semantics:
 *  - Reads never mutate and never trigger a flush.
 *  - Every mutation is applied to memory first, then handed to the store's
 *    FlushPolicy. Under write-through a failed flush is thrown from the
 *    mutation even though memory has already changed.
 *  - get() returns null when the key is absent. Null keys and values are rejected.
 *  - Values are copied in and copied out. Mutating a value passed to or
 *    returned from the store never changes what the store holds.
 *  - Each call is atomic with respect to the backend; nothing spans two calls.
 */
public interface KeyValueStore<K, V> {

    // ---------- reads ----------

    V get(K key);

    boolean containsKey(K key);

    int size();

    boolean isEmpty();

    /** Point-in-time copy of all entries, in no particular order. */
    List<Map.Entry<K, V>> entries();

    List<K> keys();

    List<V> values();

    /** The JSON file this store persists to. */
    Path path();

    FlushPolicy policy();

    FlushStats flushStats();

    // ---------- writes ----------

    /** Insert or overwrite. Returns the previous value or null. */
    V insert(K key, V value);

    /** Returns the removed value or null. */
    V remove(K key);

    void clear();

    /** Insert every entry, then apply the flush policy once. */
    void extend(Map<? extends K, ? extends V> entries);

    /** Insert every entry, then apply the flush policy once. */
    void extend(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries);

    /**
     * Replace the value at key with mutator(current). The mutator gets a
     * copy and may change it in place before returning it.
     * <p>
     * This is a get followed by an insert. Another writer can slip in between
     * and its write is then lost. Only safe with a single writer per key.
     *
     * @return false if the key is absent (nothing is changed), true otherwise.
     */
    boolean update(K key, UnaryOperator<V> mutator);

    /** Existing value, or insert defaultValue and return it. */
    V getOrInsert(K key, V defaultValue);

    /** Like getOrInsert(), but the default is only computed when the key is missing. */
    V getOrInsertWith(K key, Supplier<? extends V> defaultSupplier);

    // ---------- persistence ----------

    /** Write a full snapshot to disk now, whatever the policy. */
    void flush();
}
