package io.jsonkv.storage;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FlushSignalTest {

    @Test
    void nudges_coalesce_until_consumed() throws Exception {
        var signal = new FlushSignal();
        assertTrue(signal.nudge());
        assertFalse(signal.nudge());

        assertEquals(FlushSignal.Wakeup.NUDGED, signal.await(Duration.ofSeconds(1)));
        assertTrue(signal.nudge());
    }

    @Test
    void await_times_out_without_nudge() throws Exception {
        var signal = new FlushSignal();
        assertEquals(FlushSignal.Wakeup.TIMED_OUT, signal.await(Duration.ofMillis(20)));
    }

    @Test
    void close_wakes_a_waiter_and_wins_over_pending_nudge() throws Exception {
        var signal = new FlushSignal();
        var waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return signal.await(Duration.ofHours(1));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        signal.nudge();
        signal.close();

        FlushSignal.Wakeup first = waiter.get(5, TimeUnit.SECONDS);
        assertNotEquals(FlushSignal.Wakeup.TIMED_OUT, first);
        assertEquals(FlushSignal.Wakeup.CLOSED, signal.await(Duration.ofHours(1)));
        assertTrue(signal.isClosed());
        assertFalse(signal.nudge());
    }
}
