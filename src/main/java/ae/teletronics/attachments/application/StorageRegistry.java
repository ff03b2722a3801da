package ae.teletronics.attachments.application;

import ae.teletronics.attachments.application.exceptions.StorageConfigurationException;
import ae.teletronics.attachments.domain.model.UploadedFile;
import ae.teletronics.attachments.ports.StoragePort;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Storage backends by key ("cache", "store", ...). Built once at startup and read-only afterwards;
 * handed explicitly to the {@link Uploader} and every {@link Attacher}.
 *
 * Also hosts the operations on an {@link UploadedFile} that need its backend.
 */
public final class StorageRegistry {

    private final Map<String, StoragePort> storages;

    public StorageRegistry(Map<String, ? extends StoragePort> storages) {
        Objects.requireNonNull(storages, "storages");
        Map<String, StoragePort> copy = new LinkedHashMap<>();
        storages.forEach((key, storage) -> {
            if (key == null || key.isBlank()) {
                throw new StorageConfigurationException("Storage key must not be blank");
            }
            if (storage == null) {
                throw new StorageConfigurationException("No backend given for storage '" + key + "'");
            }
            copy.put(key, storage);
        });
        this.storages = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws StorageConfigurationException for an unknown key
     */
    public StoragePort resolve(String storageKey) {
        StoragePort storage = storageKey == null ? null : storages.get(storageKey);
        if (storage == null) {
            throw new StorageConfigurationException(
                    "Unknown storage '" + storageKey + "' (configured: " + storages.keySet() + ")");
        }
        return storage;
    }

    public boolean contains(String storageKey) {
        return storages.containsKey(storageKey);
    }

    public Set<String> keys() {
        return storages.keySet();
    }

    /** Fails unless every key is configured. */
    public void require(String... storageKeys) {
        for (String key : storageKeys) {
            resolve(key);
        }
    }

    /* -------------------- UploadedFile operations -------------------- */

    /** Lazy stream over the stored bytes; fails with NoSuchFileException when the object is gone. */
    public InputStream open(UploadedFile file) throws IOException {
        return resolve(file.storageKey()).open(file.id());
    }

    public boolean exists(UploadedFile file) throws IOException {
        return resolve(file.storageKey()).exists(file.id());
    }

    public String url(UploadedFile file, Map<String, ?> options) {
        return resolve(file.storageKey()).url(file.id(), options == null ? Map.of() : options);
    }

    public void delete(UploadedFile file) throws IOException {
        resolve(file.storageKey()).delete(file.id());
    }

    /**
     * Copies the stored bytes into a new temp file named with the file's extension.
     * The caller owns (and deletes) the returned file.
     */
    public Path download(UploadedFile file) throws IOException {
        String suffix = file.extension().map(ext -> "." + ext).orElse("");
        Path tempFile = Files.createTempFile("attachment-", suffix);
        try (InputStream in = open(file)) {
            Files.copy(in, tempFile, StandardCopyOption.REPLACE_EXISTING);
            return tempFile;
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    public static final class Builder {
        private final Map<String, StoragePort> storages = new LinkedHashMap<>();

        private Builder() { }

        public Builder storage(String key, StoragePort storage) {
            storages.put(key, storage);
            return this;
        }

        public StorageRegistry build() {
            return new StorageRegistry(storages);
        }
    }
}
