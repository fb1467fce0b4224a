// file: src/main/java/io/jsonkv/storage/backend/ShardedMapBackend.java
package io.jsonkv.storage.backend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Default backend: the key space is split across a fixed number of shards,
 * each a plain HashMap guarded by its own read/write lock.
 * <p>
 * Properties:
 *  - Writers to different shards never contend.
 *  - snapshot() copies one shard at a time under that shard's read lock, so a
 *    writer waits for at most one shard copy. The result is consistent per
 *    shard, not across shards.
 *  - clear() empties each shard under its write lock.
 */
public final class ShardedMapBackend<K, V> implements MapBackend<K, V> {

    public static final int DEFAULT_SHARDS = 16;

    private final List<Shard<K, V>> shards;
    private final int mask;

    public ShardedMapBackend() {
        this(DEFAULT_SHARDS);
    }

    public ShardedMapBackend(int shardCount) {
        if (shardCount <= 0 || Integer.bitCount(shardCount) != 1) {
            throw new IllegalArgumentException("shardCount must be a positive power of two, got: " + shardCount);
        }
        List<Shard<K, V>> list = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) {
            list.add(new Shard<>());
        }
        this.shards = List.copyOf(list);
        this.mask = shardCount - 1;
    }

    @Override
    public V insert(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Shard<K, V> shard = shardFor(key);
        shard.lock.writeLock().lock();
        try {
            return shard.map.put(key, value);
        } finally {
            shard.lock.writeLock().unlock();
        }
    }

    @Override
    public V get(K key) {
        Objects.requireNonNull(key, "key");
        Shard<K, V> shard = shardFor(key);
        shard.lock.readLock().lock();
        try {
            return shard.map.get(key);
        } finally {
            shard.lock.readLock().unlock();
        }
    }

    @Override
    public V remove(K key) {
        Objects.requireNonNull(key, "key");
        Shard<K, V> shard = shardFor(key);
        shard.lock.writeLock().lock();
        try {
            return shard.map.remove(key);
        } finally {
            shard.lock.writeLock().unlock();
        }
    }

    @Override
    public List<Map.Entry<K, V>> snapshot() {
        List<Map.Entry<K, V>> out = new ArrayList<>();
        for (Shard<K, V> shard : shards) {
            shard.lock.readLock().lock();
            try {
                for (Map.Entry<K, V> e : shard.map.entrySet()) {
                    out.add(Map.entry(e.getKey(), e.getValue()));
                }
            } finally {
                shard.lock.readLock().unlock();
            }
        }
        return out;
    }

    @Override
    public int size() {
        int total = 0;
        for (Shard<K, V> shard : shards) {
            shard.lock.readLock().lock();
            try {
                total += shard.map.size();
            } finally {
                shard.lock.readLock().unlock();
            }
        }
        return total;
    }

    @Override
    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key");
        Shard<K, V> shard = shardFor(key);
        shard.lock.readLock().lock();
        try {
            return shard.map.containsKey(key);
        } finally {
            shard.lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        for (Shard<K, V> shard : shards) {
            shard.lock.writeLock().lock();
            try {
                shard.map.clear();
            } finally {
                shard.lock.writeLock().unlock();
            }
        }
    }

    public int shardCount() {
        return shards.size();
    }

    private Shard<K, V> shardFor(K key) {
        int h = key.hashCode();
        // spread high bits so keys with similar low bits still land on different shards
        h ^= (h >>> 16);
        return shards.get(h & mask);
    }

    private static final class Shard<K, V> {
        final Map<K, V> map = new HashMap<>();
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    }
}
