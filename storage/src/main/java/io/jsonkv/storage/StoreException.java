// file: src/main/java/io/jsonkv/storage/StoreException.java
package io.jsonkv.storage;

/**
 * Failure raised by store construction, persistence or flushing.
 * <p>
 * Kinds:
 *  - StorageIoException:   the file system refused a read, write or rename.
 *  - SerializeException:   the in-memory map could not be encoded.
 *  - DeserializeException: the bytes on disk are not a valid encoded map.
 *  - ConfigException:      invalid construction parameters.
 * <p>
 * A StorageIoException thrown from a write-through mutation means the map has
 * already changed in memory but the file may now lag behind it.
 */
public sealed class StoreException extends RuntimeException
        permits StoreException.StorageIoException,
                StoreException.SerializeException,
                StoreException.DeserializeException,
                StoreException.ConfigException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class StorageIoException extends StoreException {
        public StorageIoException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class SerializeException extends StoreException {
        public SerializeException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class DeserializeException extends StoreException {
        public DeserializeException(String message) {
            super(message);
        }

        public DeserializeException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class ConfigException extends StoreException {
        public ConfigException(String message) {
            super(message);
        }

        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
