package ae.teletronics.attachments.application;

import ae.teletronics.attachments.domain.model.AttachmentState;
import ae.teletronics.attachments.domain.model.AttachmentStatus;
import ae.teletronics.attachments.domain.model.UploadedFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/** At most one file per record. */
public class SingleAttachmentField extends AttachmentField<UploadedFile> {

    private final Attacher attacher;

    /**
     * @param data the column value as last persisted, null or "null" for none
     */
    public SingleAttachmentField(String name, Uploader uploader, AttachmentDataCodec codec,
                                 String cacheKey, String storeKey, String data) {
        super(name, uploader, codec, cacheKey, storeKey);
        UploadedFile persisted = codec.read(data);
        this.attacher = persisted == null
                ? newAttacher()
                : Attacher.fromPersisted(uploader, cacheKey, storeKey, persisted);
    }

    /** Attach new content; null detaches. */
    public UploadedFile attach(InputStream content, UploadContext context) throws IOException {
        return attacher.attach(content, context);
    }

    public void attachCached(UploadedFile cached) throws IOException {
        attacher.attachCached(cached);
    }

    public void detach() {
        attacher.detach();
    }

    @Override
    public UploadedFile get() {
        return attacher.file();
    }

    public String url(Map<String, ?> options) {
        return attacher.url(noOptions(options));
    }

    public AttachmentStatus status() {
        return attacher.status();
    }

    public AttachmentState state() {
        return attacher.state();
    }

    @Override
    public boolean isChanged() {
        return attacher.isDirty();
    }

    @Override
    public String toData() {
        return codec.write(attacher.file());
    }

    @Override
    public void beforeSave() throws IOException {
        if (isChanged()) {
            attacher.promote();
        }
    }

    @Override
    public void afterSave() throws IOException {
        attacher.persist();
    }

    @Override
    public void afterDestroy() throws IOException {
        attacher.destroyAttached();
    }
}
