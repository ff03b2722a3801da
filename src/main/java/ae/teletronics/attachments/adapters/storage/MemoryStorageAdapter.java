package ae.teletronics.attachments.adapters.storage;

import ae.teletronics.attachments.ports.StoragePort;
import ae.teletronics.attachments.ports.StoredSource;
import ae.teletronics.attachments.ports.StreamSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps objects in a plain map. Meant for tests and local experiments.
 * Not thread-safe: callers sharing an instance across threads must serialize access.
 */
public class MemoryStorageAdapter implements StoragePort {

    private final Map<String, byte[]> store = new HashMap<>();

    @Override
    public void upload(StreamSource source, String id, boolean move) throws IOException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(id, "id");

        if (move && source instanceof StoredSource stored && stored.isIn(this)) {
            byte[] bytes = store.remove(stored.id());
            if (bytes == null) throw new NoSuchFileException(stored.id());
            store.put(id, bytes);
            return;
        }

        byte[] bytes;
        try (InputStream in = source.openStream()) {
            bytes = in.readAllBytes();
        }
        store.put(id, bytes);
    }

    @Override
    public InputStream open(String id) throws IOException {
        byte[] bytes = store.get(id);
        if (bytes == null) throw new NoSuchFileException(id, null, "file not found on memory storage");
        return new ByteArrayInputStream(bytes);
    }

    @Override
    public boolean exists(String id) {
        return store.containsKey(id);
    }

    @Override
    public void delete(String id) {
        store.remove(id);
    }

    @Override
    public void deletePrefixed(String prefix) {
        String dir = StoragePort.directoryPrefix(prefix);
        store.keySet().removeIf(key -> key.startsWith(dir));
    }

    @Override
    public String url(String id, Map<String, ?> options) {
        return "memory://" + id;
    }

    public int size() {
        return store.size();
    }

    /** Drops every object, e.g. between tests. */
    public void clear() {
        store.clear();
    }
}
