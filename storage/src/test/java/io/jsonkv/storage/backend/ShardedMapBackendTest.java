package io.jsonkv.storage.backend;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShardedMapBackendTest extends MapBackendContract {

    @Override
    protected MapBackend<String, Integer> newBackend() {
        return new ShardedMapBackend<>();
    }

    @Test
    void shard_count_must_be_a_power_of_two() {
        assertEquals(ShardedMapBackend.DEFAULT_SHARDS, new ShardedMapBackend<String, Integer>().shardCount());
        assertEquals(1, new ShardedMapBackend<String, Integer>(1).shardCount());
        assertThrows(IllegalArgumentException.class, () -> new ShardedMapBackend<String, Integer>(12));
        assertThrows(IllegalArgumentException.class, () -> new ShardedMapBackend<String, Integer>(0));
    }

    @Test
    void single_shard_still_behaves_like_a_map() {
        var single = new ShardedMapBackend<String, Integer>(1);
        single.insert("a", 1);
        single.insert("b", 2);
        assertEquals(2, single.size());
        assertEquals(1, single.remove("a"));
        assertEquals(1, single.snapshot().size());
    }
}
