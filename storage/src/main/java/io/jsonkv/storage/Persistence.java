// file: src/main/java/io/jsonkv/storage/Persistence.java
package io.jsonkv.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Disk I/O for a store file.
 * <p>
 * load():
 *  - missing file or zero-length file -> empty map (first run, truncated file),
 *  - otherwise the whole file is decoded; decode errors propagate.
 * <p>
 * atomicWrite():
 *  - write the bytes to a sibling temp file ("db.json" -> "db.json.tmp") and fsync it,
 *  - then move it over the target using ATOMIC_MOVE.
 * Readers of the target see either the old or the new content, never a mix,
 * as long as the file system renames atomically. Network and some removable
 * file systems do not; there we fall back to a plain replacing move.
 * A crash between write and rename can leave the temp file behind.
 */
public final class Persistence {
    private static final Logger log = Logger.getLogger(Persistence.class.getName());

    static final String TEMP_SUFFIX = ".tmp";
    static final String DEFAULT_EXTENSION = ".json";

    private Persistence() {
        // utility
    }

    public static <K, V> Map<K, V> load(Path path, Serializer<K, V> serializer) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return new HashMap<>();
        } catch (IOException e) {
            throw new StoreException.StorageIoException("failed to read " + path, e);
        }
        if (bytes.length == 0) {
            return new HashMap<>();
        }
        return serializer.decode(bytes);
    }

    public static void atomicWrite(Path path, byte[] bytes) {
        Path tmp = tempPathFor(path);

        try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        } catch (IOException e) {
            deleteTempFile(tmp);
            throw new StoreException.StorageIoException("failed to write " + tmp, e);
        }

        try {
            moveIntoPlace(tmp, path);
        } catch (IOException e) {
            deleteTempFile(tmp);
            throw new StoreException.StorageIoException("failed to rename " + tmp + " to " + path, e);
        }
    }

    /**
     * Temp file used by atomicWrite(): same directory, ".tmp" appended to the
     * file name, with ".json" inserted first when the name has no extension.
     */
    public static Path tempPathFor(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            name = name + DEFAULT_EXTENSION;
        }
        return path.resolveSibling(name + TEMP_SUFFIX);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.log(Level.WARNING, "atomic rename not supported for {0}, falling back to a replacing move", target);
            Files.move(tmp, target, REPLACE_EXISTING);
        }
    }

    private static void deleteTempFile(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.log(Level.WARNING, "could not remove temp file " + tmp, e);
        }
    }
}
