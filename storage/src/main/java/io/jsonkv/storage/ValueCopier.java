package io.jsonkv.storage;

/**
 * Makes an independent copy of a value. The store copies every value it takes
 * in and every value it hands out, so a caller can never change stored state
 * behind the flush policy's back.
 */
@FunctionalInterface
public interface ValueCopier<V> {

    V copy(V value);

    /** No copying. Only safe when every value is deeply immutable. */
    static <V> ValueCopier<V> identity() {
        return value -> value;
    }
}
