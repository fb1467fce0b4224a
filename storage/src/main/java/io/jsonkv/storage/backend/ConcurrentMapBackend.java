// file: src/main/java/io/jsonkv/storage/backend/ConcurrentMapBackend.java
package io.jsonkv.storage.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backend over a ConcurrentHashMap.
 * <p>
 * snapshot() walks the map with its weakly consistent iterator, so it never
 * blocks writers; entries written during the walk may or may not appear.
 */
public final class ConcurrentMapBackend<K, V> implements MapBackend<K, V> {

    private final ConcurrentHashMap<K, V> map = new ConcurrentHashMap<>();

    @Override
    public V insert(K key, V value) {
        return map.put(key, value);
    }

    @Override
    public V get(K key) {
        return map.get(key);
    }

    @Override
    public V remove(K key) {
        return map.remove(key);
    }

    @Override
    public List<Map.Entry<K, V>> snapshot() {
        List<Map.Entry<K, V>> out = new ArrayList<>(map.size());
        map.forEach((k, v) -> out.add(Map.entry(k, v)));
        return out;
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public boolean containsKey(K key) {
        return map.containsKey(key);
    }

    @Override
    public void clear() {
        map.clear();
    }
}
