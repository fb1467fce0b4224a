// file: src/main/java/io/jsonkv/storage/FlushSignal.java
package io.jsonkv.storage;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wake-up channel between a store and its flush worker.
 * <p>
 * Semantics:
 *  - nudge() records one pending wake-up and returns immediately. While a
 *    wake-up is already pending further nudges are coalesced into it.
 *  - await() blocks until a nudge, the timeout, or close(), whichever is first.
 *    It consumes the pending nudge. close() wins over a pending nudge.
 *  - close() is permanent and idempotent.
 */
public final class FlushSignal implements AutoCloseable {

    public enum Wakeup {
        NUDGED,
        TIMED_OUT,
        CLOSED
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean pending;
    private boolean closed;

    /**
     * @return true if this call registered a new wake-up, false if one was
     *         already pending or the signal is closed.
     */
    public boolean nudge() {
        lock.lock();
        try {
            if (closed || pending) {
                return false;
            }
            pending = true;
            changed.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Wakeup await(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (!closed && !pending) {
                if (nanos <= 0L) {
                    return Wakeup.TIMED_OUT;
                }
                nanos = changed.awaitNanos(nanos);
            }
            if (closed) {
                return Wakeup.CLOSED;
            }
            pending = false;
            return Wakeup.NUDGED;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
