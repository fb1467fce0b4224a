// file: src/main/java/io/jsonkv/storage/FlushPolicy.java
package io.jsonkv.storage;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides what happens after each mutation of a store.
 * <p>
 * Policies:
 *  - WriteThrough:       flush synchronously after every mutation. Safest, most I/O.
 *  - BackgroundInterval: a worker thread flushes every interval and whenever it
 *                        is nudged by a mutation. Nudges are coalesced.
 *  - CallerDriven:       nothing happens until the caller invokes flush().
 * <p>
 * A store keeps one policy for its whole lifetime.
 */
public sealed interface FlushPolicy
        permits FlushPolicy.WriteThrough, FlushPolicy.BackgroundInterval, FlushPolicy.CallerDriven {

    /** What the store must do once a mutation has been applied to the backend. */
    enum Action {
        FLUSH_NOW,
        NUDGE_WORKER,
        NONE
    }

    Action onMutation();

    /** Name used in config files and on the command line. */
    String name();

    record WriteThrough() implements FlushPolicy {
        @Override
        public Action onMutation() {
            return Action.FLUSH_NOW;
        }

        @Override
        public String name() {
            return "write-through";
        }
    }

    record BackgroundInterval(Duration interval) implements FlushPolicy {
        public BackgroundInterval {
            if (interval == null) {
                throw new StoreException.ConfigException("flush interval must not be null");
            }
            if (interval.isZero() || interval.isNegative()) {
                throw new StoreException.ConfigException("flush interval must be positive, got: " + interval);
            }
        }

        @Override
        public Action onMutation() {
            return Action.NUDGE_WORKER;
        }

        @Override
        public String name() {
            return "background-interval";
        }
    }

    record CallerDriven() implements FlushPolicy {
        @Override
        public Action onMutation() {
            return Action.NONE;
        }

        @Override
        public String name() {
            return "caller-driven";
        }
    }

    static FlushPolicy writeThrough() {
        return new WriteThrough();
    }

    static FlushPolicy backgroundInterval(Duration interval) {
        return new BackgroundInterval(interval);
    }

    static FlushPolicy callerDriven() {
        return new CallerDriven();
    }

    /**
     * Parse a policy name ("write-through", "background-interval", "caller-driven",
     * case-insensitive). interval is only read for background-interval.
     */
    static FlushPolicy parse(String name, Duration interval) {
        Objects.requireNonNull(name, "name");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "write-through" -> writeThrough();
            case "background-interval" -> backgroundInterval(interval);
            case "caller-driven" -> callerDriven();
            default -> throw new StoreException.ConfigException(
                    "unknown flush policy '" + name + "', expected write-through, background-interval or caller-driven");
        };
    }
}
