package io.jsonkv.storage.backend;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every MapBackend must show. Subclasses only supply the instance.
 */
abstract class MapBackendContract {

    protected MapBackend<String, Integer> map;

    protected abstract MapBackend<String, Integer> newBackend();

    @BeforeEach
    void setUp() {
        map = newBackend();
    }

    @Test
    void insert_returns_previous_value() {
        assertNull(map.insert("a", 1));
        assertEquals(1, map.insert("a", 2));
        assertEquals(2, map.get("a"));
    }

    @Test
    void get_and_remove_of_absent_key_return_null() {
        assertNull(map.get("missing"));
        assertNull(map.remove("missing"));
    }

    @Test
    void remove_returns_removed_value() {
        map.insert("a", 1);
        assertEquals(1, map.remove("a"));
        assertNull(map.get("a"));
        assertFalse(map.containsKey("a"));
    }

    @Test
    void size_and_contains_key() {
        assertEquals(0, map.size());
        map.insert("a", 1);
        map.insert("b", 2);
        map.insert("a", 3);
        assertEquals(2, map.size());
        assertTrue(map.containsKey("b"));
        assertFalse(map.containsKey("c"));
    }

    @Test
    void snapshot_is_an_independent_copy() {
        map.insert("a", 1);
        map.insert("b", 2);

        List<Map.Entry<String, Integer>> snap = map.snapshot();
        map.insert("c", 3);
        map.remove("a");

        assertEquals(2, snap.size());
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, Integer> e : snap) keys.add(e.getKey());
        keys.sort(null);
        assertEquals(List.of("a", "b"), keys);

        snap.clear(); // caller owns the list
        assertEquals(2, map.size());
    }

    @Test
    void clear_empties_the_map() {
        for (int i = 0; i < 100; i++) map.insert("k" + i, i);
        map.clear();
        assertEquals(0, map.size());
        assertTrue(map.snapshot().isEmpty());
    }

    @Test
    void nulls_are_rejected() {
        assertThrows(NullPointerException.class, () -> map.insert(null, 1));
        assertThrows(NullPointerException.class, () -> map.insert("a", null));
        assertThrows(NullPointerException.class, () -> map.get(null));
    }

    @Test
    void concurrent_inserts_from_many_threads_are_all_kept() throws Exception {
        int threads = 8;
        int perThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        map.insert("t" + id + "-" + i, i);
                        if (i % 100 == 0) map.snapshot();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }
        assertEquals(threads * perThread, map.size());
        assertEquals(threads * perThread, map.snapshot().size());
    }
}
