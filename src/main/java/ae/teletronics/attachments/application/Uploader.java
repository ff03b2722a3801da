package ae.teletronics.attachments.application;

import ae.teletronics.attachments.application.location.LocationGenerator;
import ae.teletronics.attachments.application.metadata.MetadataExtractor;
import ae.teletronics.attachments.application.util.TempFileSpool;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.domain.model.UploadedFile;
import ae.teletronics.attachments.ports.StoragePort;
import ae.teletronics.attachments.ports.StoredSource;
import ae.teletronics.attachments.ports.StreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Writes content into a storage backend and hands back the reference to it.
 *
 * Each upload is spooled to a temp file, analyzed (and possibly rejected) by the
 * {@link MetadataExtractor}, given a fresh id by the {@link LocationGenerator}, then written.
 * Nothing reaches the backend when analysis fails.
 */
public class Uploader {

    private static final Logger log = LoggerFactory.getLogger(Uploader.class);

    private final StorageRegistry storages;
    private final MetadataExtractor extractor;
    private final LocationGenerator locations;
    private final long maxSize;

    public Uploader(StorageRegistry storages, MetadataExtractor extractor, LocationGenerator locations) {
        this(storages, extractor, locations, Long.MAX_VALUE);
    }

    /**
     * @param maxSize bytes accepted while spooling; larger uploads are rejected before analysis
     */
    public Uploader(StorageRegistry storages, MetadataExtractor extractor, LocationGenerator locations, long maxSize) {
        this.storages = Objects.requireNonNull(storages, "storages");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.locations = Objects.requireNonNull(locations, "locations");
        if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be positive");
        this.maxSize = maxSize;
    }

    public StorageRegistry storages() {
        return storages;
    }

    /**
     * Upload a one-shot stream. The stream is consumed and closed.
     */
    public UploadedFile upload(InputStream content, String storageKey, UploadContext context) throws IOException {
        Objects.requireNonNull(content, "content");
        StoragePort storage = storages.resolve(storageKey);
        try (TempFileSpool spool = TempFileSpool.spool(content, maxSize)) {
            return write(spool, storage, storageKey, context);
        }
    }

    /**
     * Upload from a source that can be re-opened (a file on disk, a byte array) without spooling.
     */
    public UploadedFile upload(StreamSource source, String storageKey, UploadContext context) throws IOException {
        Objects.requireNonNull(source, "source");
        return write(source, storages.resolve(storageKey), storageKey, context);
    }

    private UploadedFile write(StreamSource source, StoragePort storage, String storageKey, UploadContext context) throws IOException {
        FileMetadata metadata = extractMetadata(source, context);
        String id = locations.generate(metadata, UploadedFile.extensionOf(metadata.filename()).orElse(null));
        storage.upload(source, id, false);
        log.debug("Uploaded {} to '{}' ({} bytes, {})", id, storageKey, metadata.size(), metadata.mimeType());
        return new UploadedFile(id, storageKey, metadata);
    }

    public FileMetadata extractMetadata(StreamSource source, UploadContext context) throws IOException {
        return extractor.extract(source, context);
    }

    /**
     * Re-homes {@code existing} into {@code toStorageKey} under a new id, keeping its extension and
     * metadata. The source object is gone afterwards: renamed when the target backend can reach it
     * (the same adapter, or filesystem adapters under one root), deleted after the copy otherwise.
     */
    public UploadedFile move(UploadedFile existing, String toStorageKey) throws IOException {
        Objects.requireNonNull(existing, "existing");
        StoragePort from = storages.resolve(existing.storageKey());
        StoragePort to = storages.resolve(toStorageKey);

        String id = locations.generate(existing.metadata(), existing.extension().orElse(null));
        to.upload(new StoredSource(from, existing.id()), id, true);
        if (from != to) {
            from.delete(existing.id());
        }
        log.debug("Moved {}:{} -> {}:{}", existing.storageKey(), existing.id(), toStorageKey, id);
        return new UploadedFile(id, toStorageKey, existing.metadata());
    }
}
