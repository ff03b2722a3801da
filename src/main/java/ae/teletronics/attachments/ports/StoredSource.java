package ae.teletronics.attachments.ports;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Bytes of an object that already lives in a storage backend.
 * Adapters recognise it when {@code move} is requested and the object sits in the same adapter
 * (or, for the filesystem, under the same root) and rename instead of copying.
 */
public record StoredSource(StoragePort storage, String id) implements StreamSource {

    public StoredSource {
        Objects.requireNonNull(storage, "storage");
        Objects.requireNonNull(id, "id");
    }

    public boolean isIn(StoragePort candidate) {
        return storage == candidate;
    }

    @Override
    public InputStream openStream() throws IOException {
        return storage.open(id);
    }
}
