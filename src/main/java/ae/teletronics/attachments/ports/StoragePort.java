package ae.teletronics.attachments.ports;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Abstraction over the physical storage (memory, local FS, S3, MinIO, etc.).
 * Objects are addressed by a backend-relative id (a path or object key).
 */
public interface StoragePort {

    /** URL option holding a signature lifetime in seconds. Only signing backends honour it. */
    String EXPIRES_IN = "expires_in";

    /**
     * Persist the binary stream under {@code id}, replacing any previous object.
     *
     * @param source  re-openable stream source
     * @param id      backend-relative id
     * @param move    when true and {@code source} is a {@link StoredSource} of this backend,
     *                rename the object instead of copying it
     */
    void upload(StreamSource source, String id, boolean move) throws IOException;

    /**
     * Open the stored object for lazy reading.
     *
     * @throws java.nio.file.NoSuchFileException if nothing is stored under {@code id}
     */
    InputStream open(String id) throws IOException;

    boolean exists(String id) throws IOException;

    /**
     * Delete the stored object. Should be idempotent: no error if the object doesn't exist.
     */
    void delete(String id) throws IOException;

    /**
     * Delete every object whose id lives under {@code prefix}, treated as a directory.
     * Does nothing when no object matches.
     *
     * @throws IllegalArgumentException for a blank prefix
     */
    void deletePrefixed(String prefix) throws IOException;

    /**
     * Build an access URL. Unsupported options are ignored.
     */
    String url(String id, Map<String, ?> options);

    default String url(String id) {
        return url(id, Map.of());
    }

    /** Normalises a prefix to the directory form used by {@link #deletePrefixed}, e.g. "a/b" -> "a/b/". */
    static String directoryPrefix(String prefix) {
        String p = prefix == null ? "" : prefix.trim().replace("\\", "/");
        while (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        if (p.isEmpty()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        return p + "/";
    }
}
