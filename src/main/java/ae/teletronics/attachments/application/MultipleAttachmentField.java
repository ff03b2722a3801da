package ae.teletronics.attachments.application;

import ae.teletronics.attachments.application.exceptions.InvalidFileException;
import ae.teletronics.attachments.domain.model.UploadedFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered list of files per record, each with its own {@link Attacher}.
 *
 * {@link #remove} and {@link #clear} delete the backing objects right away; files dropped by
 * {@link #replaceAll} are deleted once the record has been saved.
 */
public class MultipleAttachmentField extends AttachmentField<List<UploadedFile>> {

    private final List<Attacher> attachers = new ArrayList<>();
    private final List<Attacher> replaced = new ArrayList<>();
    private final int maxFiles;
    private boolean changed;

    public MultipleAttachmentField(String name, Uploader uploader, AttachmentDataCodec codec,
                                   String cacheKey, String storeKey, String data) {
        this(name, uploader, codec, cacheKey, storeKey, data, Integer.MAX_VALUE);
    }

    /**
     * @param data     the column value as last persisted, null or "[]" for none
     * @param maxFiles most files the field may hold
     */
    public MultipleAttachmentField(String name, Uploader uploader, AttachmentDataCodec codec,
                                   String cacheKey, String storeKey, String data, int maxFiles) {
        super(name, uploader, codec, cacheKey, storeKey);
        if (maxFiles <= 0) throw new IllegalArgumentException("maxFiles must be positive");
        this.maxFiles = maxFiles;
        for (UploadedFile file : codec.readList(data)) {
            attachers.add(Attacher.fromPersisted(uploader, cacheKey, storeKey, file));
        }
    }

    /**
     * Upload and append one file. Fails without changes when the field is full or the upload fails.
     */
    public UploadedFile add(InputStream content, UploadContext context) throws IOException {
        Objects.requireNonNull(content, "content");
        if (attachers.size() >= maxFiles) {
            throw new InvalidFileException("too many files (maximum is " + maxFiles + ")");
        }
        Attacher attacher = newAttacher();
        UploadedFile file = attacher.attach(content, context);
        attachers.add(attacher);
        changed = true;
        return file;
    }

    /**
     * Drop {@code file} from the list and delete it from storage.
     *
     * @return false when the field doesn't hold that file
     */
    public boolean remove(UploadedFile file) throws IOException {
        Objects.requireNonNull(file, "file");
        Iterator<Attacher> it = attachers.iterator();
        while (it.hasNext()) {
            Attacher attacher = it.next();
            if (file.equals(attacher.file())) {
                attacher.destroyAttached();
                it.remove();
                changed = true;
                return true;
            }
        }
        return false;
    }

    /** Delete every file and empty the list. */
    public void clear() throws IOException {
        Iterator<Attacher> it = attachers.iterator();
        while (it.hasNext()) {
            it.next().destroyAttached();
            it.remove();
        }
        changed = true;
    }

    /**
     * Replace the whole list with new uploads. The old files stay in storage until
     * {@link #afterSave()}. If one upload fails the list is left as it was.
     */
    public List<UploadedFile> replaceAll(List<? extends InputStream> contents, List<UploadContext> contexts) throws IOException {
        if (contents.size() > maxFiles) {
            throw new InvalidFileException("too many files (maximum is " + maxFiles + ")");
        }
        if (contexts != null && contexts.size() != contents.size()) {
            throw new IllegalArgumentException("expected " + contents.size() + " contexts, got " + contexts.size());
        }
        List<Attacher> fresh = new ArrayList<>();
        try {
            for (int i = 0; i < contents.size(); i++) {
                Attacher attacher = newAttacher();
                attacher.attach(contents.get(i), contexts == null ? UploadContext.empty() : contexts.get(i));
                fresh.add(attacher);
            }
        } catch (IOException | RuntimeException e) {
            for (Attacher attacher : fresh) {
                try {
                    attacher.destroyAttached();
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw e;
        }
        replaced.addAll(attachers);
        attachers.clear();
        attachers.addAll(fresh);
        changed = true;
        return get();
    }

    @Override
    public List<UploadedFile> get() {
        return Collections.unmodifiableList(attachers.stream()
                .map(Attacher::file)
                .collect(Collectors.toList()));
    }

    public int size() {
        return attachers.size();
    }

    public boolean isEmpty() {
        return attachers.isEmpty();
    }

    @Override
    public boolean isChanged() {
        return changed;
    }

    @Override
    public String toData() {
        return codec.writeList(get());
    }

    @Override
    public void beforeSave() throws IOException {
        if (!changed) return;
        for (Attacher attacher : attachers) {
            attacher.promote();
        }
    }

    @Override
    public void afterSave() throws IOException {
        if (!changed) return;
        Iterator<Attacher> it = replaced.iterator();
        while (it.hasNext()) {
            it.next().destroyAttached();
            it.remove();
        }
        for (Attacher attacher : attachers) {
            attacher.persist();
        }
        changed = false;
    }

    @Override
    public void afterDestroy() throws IOException {
        for (Attacher attacher : replaced) {
            attacher.destroyAttached();
        }
        replaced.clear();
        for (Attacher attacher : attachers) {
            attacher.destroyAttached();
        }
    }
}
