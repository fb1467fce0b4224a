// file: src/main/java/io/jsonkv/storage/AsyncFlushWorker.java
package io.jsonkv.storage;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background thread that runs a flush task on a timer and whenever it is nudged.
 * <p>
 * Loop:
 *  - wait up to 'interval' on the FlushSignal,
 *  - on a nudge or a timeout, run the task,
 *  - on close of the signal or the stop flag, exit.
 * A failing task is logged and counted; the loop keeps going.
 * <p>
 * Construction modes:
 *  - start():           the worker creates and owns its signal; use trigger() to nudge.
 *  - startWithSignal(): the caller passes a signal it keeps and nudges itself
 *                       (the store holds it and nudges after mutations).
 * <p>
 * Shutdown: close() sets the stop flag, closes the signal and joins the thread.
 * It blocks for at most one in-progress task run. Once close() returns the task
 * never runs again.
 */
public final class AsyncFlushWorker implements AutoCloseable {
    private static final Logger log = Logger.getLogger(AsyncFlushWorker.class.getName());

    private final String name;
    private final Duration interval;
    private final Runnable task;
    private final FlushSignal signal;
    private final AtomicBoolean stop = new AtomicBoolean(false);
    private final AtomicLong completedRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();
    private final Thread thread;

    private AsyncFlushWorker(String name, Duration interval, Runnable task, FlushSignal signal) {
        this.name = Objects.requireNonNull(name, "name");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.task = Objects.requireNonNull(task, "task");
        this.signal = Objects.requireNonNull(signal, "signal");
        if (interval.isZero() || interval.isNegative()) {
            throw new StoreException.ConfigException("flush interval must be positive, got: " + interval);
        }
        this.thread = new Thread(this::loop, name);
        this.thread.setDaemon(true);
    }

    /** Start a worker that owns its own signal. */
    public static AsyncFlushWorker start(String name, Duration interval, Runnable task) {
        return startWithSignal(name, interval, task, new FlushSignal());
    }

    /** Start a worker that listens on a signal the caller keeps and nudges. */
    public static AsyncFlushWorker startWithSignal(String name, Duration interval, Runnable task, FlushSignal signal) {
        AsyncFlushWorker worker = new AsyncFlushWorker(name, interval, task, signal);
        worker.thread.start();
        log.log(Level.INFO, "flush worker {0} started (interval={1})", new Object[]{name, interval});
        return worker;
    }

    /** Non-blocking nudge. Returns false when coalesced with a pending nudge or after close. */
    public boolean trigger() {
        return signal.nudge();
    }

    public long completedRuns() {
        return completedRuns.get();
    }

    public long failedRuns() {
        return failedRuns.get();
    }

    public boolean isRunning() {
        return thread.isAlive();
    }

    @Override
    public void close() {
        stop.set(true);
        signal.close();
        if (Thread.currentThread() == thread) {
            // close() from inside the task: the loop exits after this run
            return;
        }

        boolean interrupted = false;
        while (true) {
            try {
                thread.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals ----------

    private void loop() {
        while (!stop.get()) {
            FlushSignal.Wakeup wakeup;
            try {
                wakeup = signal.await(interval);
            } catch (InterruptedException e) {
                log.log(Level.FINE, "flush worker {0} interrupted, exiting", name);
                break;
            }
            if (wakeup == FlushSignal.Wakeup.CLOSED || stop.get()) {
                break;
            }
            runSafe();
        }
        log.log(Level.INFO, "flush worker {0} stopped (runs={1}, failures={2})",
                new Object[]{name, completedRuns.get(), failedRuns.get()});
    }

    private void runSafe() {
        try {
            task.run();
            completedRuns.incrementAndGet();
        } catch (RuntimeException e) {
            failedRuns.incrementAndGet();
            log.log(Level.WARNING, "background flush failed in " + name, e);
        }
    }

    @Override
    public String toString() {
        return "AsyncFlushWorker{name=" + name + ", interval=" + interval + ", running=" + isRunning() + "}";
    }
}
