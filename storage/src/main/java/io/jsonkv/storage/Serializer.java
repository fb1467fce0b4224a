// file: src/main/java/io/jsonkv/storage/Serializer.java
package io.jsonkv.storage;

import java.util.Map;

/**
 * Converts a flat snapshot of the store to bytes and back.
 * <p>
 * Contract:
 *  - decode(encode(m)) equals m for any finite map of encodable entries.
 *  - encode() signals StoreException.SerializeException for values it cannot encode.
 *  - decode() signals StoreException.DeserializeException for malformed input.
 *  - Neither method performs I/O.
 */
public interface Serializer<K, V> {

    byte[] encode(Map<K, V> snapshot);

    /** Returns a mutable map owned by the caller. */
    Map<K, V> decode(byte[] bytes);
}
