package ae.teletronics.attachments.application;

import java.util.Objects;

/**
 * Builds attachment fields for a record layer: one call per field per loaded record, instead of
 * generating accessors per field.
 */
public class AttachmentFieldFactory {

    private final Uploader uploader;
    private final AttachmentDataCodec codec;
    private final String cacheKey;
    private final String storeKey;

    public AttachmentFieldFactory(Uploader uploader, AttachmentDataCodec codec) {
        this(uploader, codec, Attacher.DEFAULT_CACHE, Attacher.DEFAULT_STORE);
    }

    public AttachmentFieldFactory(Uploader uploader, AttachmentDataCodec codec, String cacheKey, String storeKey) {
        this.uploader = Objects.requireNonNull(uploader, "uploader");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.cacheKey = cacheKey;
        this.storeKey = storeKey;
        uploader.storages().require(cacheKey, storeKey);
    }

    public SingleAttachmentField single(String name, String data) {
        return new SingleAttachmentField(name, uploader, codec, cacheKey, storeKey, data);
    }

    public MultipleAttachmentField multiple(String name, String data) {
        return new MultipleAttachmentField(name, uploader, codec, cacheKey, storeKey, data);
    }

    public MultipleAttachmentField multiple(String name, String data, int maxFiles) {
        return new MultipleAttachmentField(name, uploader, codec, cacheKey, storeKey, data, maxFiles);
    }

    /** Same uploads, different storages (e.g. a private store for one field). */
    public AttachmentFieldFactory withStorages(String cacheKey, String storeKey) {
        return new AttachmentFieldFactory(uploader, codec, cacheKey, storeKey);
    }

    public Uploader uploader() {
        return uploader;
    }
}
