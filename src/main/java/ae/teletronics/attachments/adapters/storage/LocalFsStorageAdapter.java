package ae.teletronics.attachments.adapters.storage;

import ae.teletronics.attachments.ports.StoragePort;
import ae.teletronics.attachments.ports.StoredSource;
import ae.teletronics.attachments.ports.StreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.*;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores objects as files under {@code rootDir/prefix}. Ids are relative paths.
 */
public class LocalFsStorageAdapter implements StoragePort {

    private static final Logger log = LoggerFactory.getLogger(LocalFsStorageAdapter.class);

    /** URL option overriding the configured public base URL, e.g. "https://cdn.example.com". */
    public static final String HOST = "host";

    private final Path rootDir;
    private final String prefix;
    private final Path directory;
    private final boolean fsyncOnWrite;
    private final String publicBaseUrl;

    public LocalFsStorageAdapter(Path rootDir, boolean fsyncOnWrite) {
        this(rootDir, null, fsyncOnWrite, null);
    }

    /**
     * @param rootDir       base directory
     * @param prefix        optional sub-directory namespacing this storage (e.g. "cache"); part of URLs
     * @param publicBaseUrl optional base for generated URLs; when absent URLs are root-relative paths
     */
    public LocalFsStorageAdapter(Path rootDir, String prefix, boolean fsyncOnWrite, String publicBaseUrl) {
        this.rootDir = Objects.requireNonNull(rootDir, "rootDir").toAbsolutePath().normalize();
        this.prefix = prefix == null || prefix.isBlank() ? null : sanitizeKey(prefix);
        this.directory = this.prefix == null ? this.rootDir : this.rootDir.resolve(this.prefix).normalize();
        if (!directory.startsWith(this.rootDir)) {
            throw new IllegalArgumentException("Refusing to escape root directory: " + prefix);
        }
        this.fsyncOnWrite = fsyncOnWrite;
        this.publicBaseUrl = normalizeBaseUrl(publicBaseUrl);
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void upload(StreamSource source, String id, boolean move) throws IOException {
        Objects.requireNonNull(source, "source");
        Path target = resolve(id);
        Files.createDirectories(target.getParent());

        if (move && source instanceof StoredSource stored && sharesRoot(stored.storage())) {
            LocalFsStorageAdapter owner = (LocalFsStorageAdapter) stored.storage();
            Path from = owner.resolve(stored.id());
            if (!Files.isRegularFile(from)) throw new NoSuchFileException(stored.id());
            moveInto(from, target);
            owner.pruneEmptyParents(from);
            log.debug("Moved {} -> {} in {}", from, id, directory);
            return;
        }

        // write next to the target and rename, so a failed copy never leaves a partial object under id
        Path part = Files.createTempFile(target.getParent(), ".upload-", ".part");
        try {
            try (InputStream in = source.openStream();
                 OutputStream out = Files.newOutputStream(part, StandardOpenOption.TRUNCATE_EXISTING)) {
                in.transferTo(out);
            }
            if (fsyncOnWrite) {
                try (FileChannel ch = FileChannel.open(part, StandardOpenOption.WRITE)) {
                    ch.force(true);
                }
            }
            moveInto(part, target);
        } finally {
            Files.deleteIfExists(part);
        }
        log.debug("Stored {} in {}", id, directory);
    }

    @Override
    public InputStream open(String id) throws IOException {
        Path p = resolve(id);
        if (!Files.isRegularFile(p)) throw new NoSuchFileException(id);
        return Files.newInputStream(p, StandardOpenOption.READ);
    }

    @Override
    public boolean exists(String id) throws IOException {
        return Files.isRegularFile(resolve(id));
    }

    @Override
    public void delete(String id) throws IOException {
        Path p = resolve(id);
        try {
            if (Files.deleteIfExists(p)) {
                log.debug("Deleted {} from {}", id, directory);
            }
            pruneEmptyParents(p);
        } catch (SecurityException se) {
            throw new IOException("Failed to delete: " + id, se);
        }
    }

    @Override
    public void deletePrefixed(String prefix) throws IOException {
        String dir = StoragePort.directoryPrefix(prefix);
        Path p = resolve(dir.substring(0, dir.length() - 1));
        if (!Files.isDirectory(p)) return;

        List<Path> paths;
        try (Stream<Path> walk = Files.walk(p)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path each : paths) {
            Files.deleteIfExists(each);
        }
        pruneEmptyParents(p);
        log.debug("Deleted prefix {} from {}", dir, directory);
    }

    @Override
    public String url(String id, Map<String, ?> options) {
        Object host = options == null ? null : options.get(HOST);
        String base = host != null ? normalizeBaseUrl(host.toString()) : publicBaseUrl;
        String path = (prefix == null ? "" : prefix + "/") + sanitizeKey(id);
        return (base == null ? "" : base) + "/" + path;
    }

    /* helpers */

    // adapters under one root directory sit on the same file system and can rename between each other
    private boolean sharesRoot(StoragePort other) {
        return other == this || other instanceof LocalFsStorageAdapter fs && fs.rootDir.equals(rootDir);
    }

    private void moveInto(Path from, Path target) throws IOException {
        try {
            Files.move(from, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void pruneEmptyParents(Path p) throws IOException {
        Path parent = p.getParent();
        while (parent != null && parent.startsWith(directory) && !parent.equals(directory)) {
            try {
                Files.delete(parent);
                parent = parent.getParent();
            } catch (DirectoryNotEmptyException | NoSuchFileException ex) {
                break;
            }
        }
    }

    private Path resolve(String id) throws IOException {
        Objects.requireNonNull(id, "id");
        String safe = sanitizeKey(id);
        Path p = directory.resolve(safe).normalize();
        if (!p.startsWith(directory) || p.equals(directory)) {
            throw new IOException("Refusing to escape storage directory: " + id);
        }
        return p;
    }

    private static String sanitizeKey(String input) {
        String trimmed = input.trim().replace("\\", "/");
        while (trimmed.startsWith("/")) trimmed = trimmed.substring(1);
        return trimmed;
    }

    private static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) return null;
        String b = baseUrl.trim();
        while (b.endsWith("/")) b = b.substring(0, b.length() - 1);
        return b;
    }
}
