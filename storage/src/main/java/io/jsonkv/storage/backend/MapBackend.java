// file: src/main/java/io/jsonkv/storage/backend/MapBackend.java
package io.jsonkv.storage.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Capability contract for the concurrent map that holds a store's live state.
 * <p>
 * Semantics:
 *  - insert() overwrites; the last insert for a key wins.
 *  - get()/remove() return null when the key is absent.
 *  - snapshot() returns a point-in-time copy of all entries. It must not hold a
 *    lock that blocks writers for the whole copy; a slightly stale view is
 *    acceptable when writes race with it.
 *  - No ordering is exposed.
 * <p>
 * Null keys and values are rejected with NullPointerException.
 * <p>
 * size(), containsKey() and clear() have defaults built on the required
 * operations. They are correct but slow; implementations should override them
 * with native versions.
 */
public interface MapBackend<K, V> {

    /** Insert or overwrite. Returns the previous value or null. */
    V insert(K key, V value);

    V get(K key);

    /** Remove a key. Returns the removed value or null. */
    V remove(K key);

    /**
     * Copy of all entries at some recent point in time.
     * The returned list is owned by the caller.
     */
    List<Map.Entry<K, V>> snapshot();

    default int size() {
        return snapshot().size();
    }

    default boolean containsKey(K key) {
        return get(key) != null;
    }

    /**
     * Remove every entry. The default collects keys from a snapshot and
     * removes them one at a time, so entries inserted concurrently may survive.
     */
    default void clear() {
        List<K> keys = new ArrayList<>();
        for (Map.Entry<K, V> e : snapshot()) {
            keys.add(e.getKey());
        }
        for (K key : keys) {
            remove(key);
        }
    }
}
