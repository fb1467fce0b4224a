// file: src/main/java/io/jsonkv/storage/JsonSerializer.java
package io.jsonkv.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Default serializer: one JSON object whose member names are the string form
 * of each key.
 * <p>
 * Output:
 *  - compact: {"apples":3,"bananas":5}
 *  - pretty:  Jackson's default pretty printer (one member per line, indented).
 * <p>
 * Keys go through Jackson's key (de)serializers, so strings, boxed numbers,
 * enums and UUIDs work out of the box. Values can be anything the supplied
 * ObjectMapper can bind.
 * <p>
 * Also the store's default ValueCopier: copy() round-trips a value through a
 * Jackson tree bound to the declared value type, so the copy has the same
 * shape the value would have after a flush and reload.
 */
public final class JsonSerializer<K, V> implements Serializer<K, V>, ValueCopier<V> {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

    // exact classes only: subclasses of BigInteger/BigDecimal can be mutable
    private static final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
            String.class, Boolean.class, Character.class,
            Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
            BigInteger.class, BigDecimal.class, UUID.class);

    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final JavaType writeType; // Map<K, V>: accepts any Map implementation
    private final JavaType mapType;   // HashMap<K, V> for reading
    private final JavaType valueType;
    private final boolean pretty;

    public JsonSerializer(Class<K> keyType, Class<V> valueType, boolean pretty) {
        this(DEFAULT_MAPPER,
                DEFAULT_MAPPER.getTypeFactory().constructType(keyType),
                DEFAULT_MAPPER.getTypeFactory().constructType(valueType),
                pretty);
    }

    /**
     * Full control: a custom mapper (extra modules, features) and Jackson types
     * for keys and values, e.g. a value type of List&lt;String&gt;.
     */
    public JsonSerializer(ObjectMapper mapper, JavaType keyType, JavaType valueType, boolean pretty) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(keyType, "keyType");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.writeType = mapper.getTypeFactory().constructMapType(Map.class, keyType, valueType);
        this.mapType = mapper.getTypeFactory().constructMapType(HashMap.class, keyType, valueType);
        this.writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        this.pretty = pretty;
    }

    @Override
    public byte[] encode(Map<K, V> snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        try {
            return writer.forType(writeType).writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new StoreException.SerializeException("failed to encode map as JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Map<K, V> decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        Map<K, V> decoded;
        try {
            decoded = mapper.readValue(bytes, mapType);
        } catch (JsonProcessingException e) {
            throw new StoreException.DeserializeException("invalid JSON map: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            // byte[] input has no real I/O underneath; anything else is still unreadable content
            throw new StoreException.DeserializeException("failed to decode JSON map", e);
        }
        if (decoded == null) {
            throw new StoreException.DeserializeException("expected a JSON object, got null");
        }
        return decoded;
    }

    @Override
    public V copy(V value) {
        if (value == null || value instanceof Enum<?> || IMMUTABLE_TYPES.contains(value.getClass())) {
            return value;
        }
        try {
            JsonNode tree = mapper.valueToTree(value);
            return mapper.treeToValue(tree, valueType);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new StoreException.SerializeException(
                    "failed to copy value of type " + value.getClass().getName(), e);
        }
    }

    public boolean isPretty() {
        return pretty;
    }

    @Override
    public String toString() {
        return "JsonSerializer{" + mapType + (pretty ? ", pretty" : "") + "}";
    }
}
