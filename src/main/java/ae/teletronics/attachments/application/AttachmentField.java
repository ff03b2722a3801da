package ae.teletronics.attachments.application;

import java.util.Map;
import java.util.Objects;

/**
 * One named attachment column of a record, single or multiple. The record layer keeps one instance
 * per field, stores {@link #toData()} in the column and drives the {@link AttachmentLifecycle}.
 *
 * @param <T> what {@link #get()} hands out
 */
public abstract class AttachmentField<T> implements AttachmentLifecycle {

    private final String name;
    protected final Uploader uploader;
    protected final AttachmentDataCodec codec;
    protected final String cacheKey;
    protected final String storeKey;

    protected AttachmentField(String name, Uploader uploader, AttachmentDataCodec codec, String cacheKey, String storeKey) {
        this.name = Objects.requireNonNull(name, "name");
        this.uploader = Objects.requireNonNull(uploader, "uploader");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.cacheKey = Objects.requireNonNull(cacheKey, "cacheKey");
        this.storeKey = Objects.requireNonNull(storeKey, "storeKey");
        uploader.storages().require(cacheKey, storeKey);
    }

    public String name() {
        return name;
    }

    public abstract T get();

    /** Whether the field changed since it was loaded or last saved. */
    public abstract boolean isChanged();

    /** JSON for the record column. */
    public abstract String toData();

    protected Attacher newAttacher() {
        return new Attacher(uploader, cacheKey, storeKey);
    }

    protected static Map<String, ?> noOptions(Map<String, ?> options) {
        return options == null ? Map.of() : options;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + "=" + get() + "}";
    }
}
