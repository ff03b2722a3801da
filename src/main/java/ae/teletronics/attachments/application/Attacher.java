package ae.teletronics.attachments.application;

import ae.teletronics.attachments.domain.model.AttachmentState;
import ae.teletronics.attachments.domain.model.AttachmentStatus;
import ae.teletronics.attachments.domain.model.UploadedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lifecycle of one attachment on one record instance: attach to cache storage, promote to
 * permanent storage before the record is saved, clean up superseded files after it was saved.
 *
 * <p>Files are only deleted from {@link #persist()} and {@link #destroyAttached()}. A replaced file
 * stays in storage until the record holding the replacement has been written, so a failed save
 * can at worst leak the new file, never lose the old one.
 *
 * <p>Not thread-safe; callers invoke one operation at a time.
 */
public class Attacher {

    private static final Logger log = LoggerFactory.getLogger(Attacher.class);

    public static final String DEFAULT_CACHE = "cache";
    public static final String DEFAULT_STORE = "store";

    private final Uploader uploader;
    private final String cacheKey;
    private final String storeKey;

    private UploadedFile current;
    // last persisted file superseded by a pending change
    private UploadedFile previous;
    // files attached and superseded again before any save; never referenced by a record
    private final List<UploadedFile> abandoned = new ArrayList<>();
    private boolean dirty;

    public Attacher(Uploader uploader) {
        this(uploader, DEFAULT_CACHE, DEFAULT_STORE);
    }

    public Attacher(Uploader uploader, String cacheKey, String storeKey) {
        this.uploader = Objects.requireNonNull(uploader, "uploader");
        this.cacheKey = Objects.requireNonNull(cacheKey, "cacheKey");
        this.storeKey = Objects.requireNonNull(storeKey, "storeKey");
        uploader.storages().require(cacheKey, storeKey);
    }

    /**
     * Attacher for a file read back from a record; starts clean.
     */
    public static Attacher fromPersisted(Uploader uploader, String cacheKey, String storeKey, UploadedFile persisted) {
        Attacher attacher = new Attacher(uploader, cacheKey, storeKey);
        attacher.current = persisted;
        return attacher;
    }

    /* -------------------- transitions -------------------- */

    /**
     * Upload {@code content} to cache storage and make it the current file.
     * A null {@code content} detaches. On failure nothing changes.
     *
     * @return the new current file, null when detached
     */
    public UploadedFile attach(InputStream content, UploadContext context) throws IOException {
        if (content == null) {
            detach();
            return null;
        }
        UploadedFile cached = uploader.upload(content, cacheKey, context);
        replaceCurrent(cached);
        log.debug("Attached {} to cache '{}'", cached.id(), cacheKey);
        return cached;
    }

    /**
     * Re-attach a file that is already in cache storage, e.g. one carried over from a form
     * redisplayed after a validation error.
     */
    public void attachCached(UploadedFile cached) throws IOException {
        Objects.requireNonNull(cached, "cached");
        if (!cacheKey.equals(cached.storageKey())) {
            throw new IllegalArgumentException("expected a file in '" + cacheKey + "', got '" + cached.storageKey() + "'");
        }
        if (!uploader.storages().exists(cached)) {
            throw new NoSuchFileException(cached.id());
        }
        if (cached.equals(current)) return;
        replaceCurrent(cached);
    }

    public void detach() {
        if (current == null) return;
        replaceCurrent(null);
        log.debug("Detached");
    }

    /**
     * Move a cached current file to permanent storage. No-op unless {@link AttachmentStatus#CACHED}.
     * The cached object is gone afterwards, so the attacher is dirty even if it was clean before.
     */
    public void promote() throws IOException {
        if (status() != AttachmentStatus.CACHED) return;
        UploadedFile stored = uploader.move(current, storeKey);
        current = stored;
        dirty = true;
        log.debug("Promoted to '{}' as {}", storeKey, stored.id());
    }

    /**
     * Call once the owning record has been written. Deletes superseded files and marks the
     * attachment clean. A failed delete leaves the attacher dirty so the call can be retried.
     */
    public void persist() throws IOException {
        if (!dirty) return;
        deletePending();
        dirty = false;
    }

    /**
     * Call after the owning record was destroyed. Deletes the current file and anything still
     * waiting for cleanup; missing objects are fine.
     */
    public void destroyAttached() throws IOException {
        deletePending();
        if (current != null) {
            uploader.storages().delete(current);
            log.debug("Destroyed {}:{}", current.storageKey(), current.id());
        }
    }

    private void replaceCurrent(UploadedFile next) {
        supersede();
        // a file brought back must not be deleted as superseded
        if (next != null) {
            abandoned.remove(next);
            if (next.equals(previous)) {
                previous = null;
            }
        }
        current = next;
        dirty = true;
    }

    private void supersede() {
        if (current == null) return;
        if (!dirty && previous == null) {
            previous = current;
        } else {
            abandoned.add(current);
        }
    }

    private void deletePending() throws IOException {
        Iterator<UploadedFile> it = abandoned.iterator();
        while (it.hasNext()) {
            uploader.storages().delete(it.next());
            it.remove();
        }
        if (previous != null) {
            uploader.storages().delete(previous);
            log.debug("Deleted replaced {}:{}", previous.storageKey(), previous.id());
            previous = null;
        }
    }

    /* -------------------- queries -------------------- */

    public UploadedFile file() {
        return current;
    }

    public AttachmentStatus status() {
        if (current == null) return AttachmentStatus.EMPTY;
        return cacheKey.equals(current.storageKey()) ? AttachmentStatus.CACHED : AttachmentStatus.STORED;
    }

    public boolean isCached() {
        return status() == AttachmentStatus.CACHED;
    }

    public boolean isStored() {
        return status() == AttachmentStatus.STORED;
    }

    public boolean isDirty() {
        return dirty;
    }

    public AttachmentState state() {
        return new AttachmentState(current, previous, dirty);
    }

    /** URL of the current file, null when empty. */
    public String url(Map<String, ?> options) {
        return current == null ? null : uploader.storages().url(current, options);
    }

    public String cacheKey() {
        return cacheKey;
    }

    public String storeKey() {
        return storeKey;
    }
}
