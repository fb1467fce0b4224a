// file: src/main/java/io/jsonkv/storage/backend/LockedMapBackend.java
package io.jsonkv.storage.backend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Simplest backend: one HashMap behind one global read/write lock.
 * Readers share the lock; every write excludes everything else.
 * snapshot() holds the read lock only while copying.
 */
public final class LockedMapBackend<K, V> implements MapBackend<K, V> {

    private final Map<K, V> map = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public V insert(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.writeLock().lock();
        try {
            return map.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public V get(K key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            return map.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public V remove(K key) {
        Objects.requireNonNull(key, "key");
        lock.writeLock().lock();
        try {
            return map.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Map.Entry<K, V>> snapshot() {
        lock.readLock().lock();
        try {
            List<Map.Entry<K, V>> out = new ArrayList<>(map.size());
            for (Map.Entry<K, V> e : map.entrySet()) {
                out.add(Map.entry(e.getKey(), e.getValue()));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return map.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            return map.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            map.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
