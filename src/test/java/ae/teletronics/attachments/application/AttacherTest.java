package ae.teletronics.attachments.application;

import ae.teletronics.attachments.adapters.detection.TikaFileTypeDetector;
import ae.teletronics.attachments.adapters.storage.MemoryStorageAdapter;
import ae.teletronics.attachments.application.exceptions.InvalidFileException;
import ae.teletronics.attachments.application.exceptions.StorageConfigurationException;
import ae.teletronics.attachments.application.location.RandomLocationGenerator;
import ae.teletronics.attachments.application.metadata.FileSizeValidator;
import ae.teletronics.attachments.application.metadata.MetadataExtractor;
import ae.teletronics.attachments.application.metadata.MimeTypeSource;
import ae.teletronics.attachments.domain.model.AttachmentState;
import ae.teletronics.attachments.domain.model.AttachmentStatus;
import ae.teletronics.attachments.domain.model.UploadedFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AttacherTest {

    private MemoryStorageAdapter cache;
    private MemoryStorageAdapter store;
    private StorageRegistry storages;
    private Uploader uploader;

    @BeforeEach
    void setUp() {
        cache = new MemoryStorageAdapter();
        store = new MemoryStorageAdapter();
        storages = StorageRegistry.builder().storage("cache", cache).storage("store", store).build();
        MetadataExtractor extractor = MetadataExtractor.defaults(new TikaFileTypeDetector(), MimeTypeSource.CONTENT)
                .with(FileSizeValidator.atMost(100));
        uploader = new Uploader(storages, extractor, new RandomLocationGenerator());
    }

    private static InputStream text(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private UploadedFile storedFile(String content) throws Exception {
        return uploader.upload(text(content), "store", UploadContext.of("old.txt"));
    }

    @Test
    void attach_promote_persist_destroy() throws Exception {
        Attacher attacher = new Attacher(uploader);

        UploadedFile cached = attacher.attach(text("hello"), UploadContext.of("a.txt"));
        assertThat(cached.metadata().size()).isEqualTo(5L);
        assertThat(cached.metadata().filename()).isEqualTo("a.txt");
        assertThat(cached.storageKey()).isEqualTo("cache");
        assertThat(attacher.status()).isEqualTo(AttachmentStatus.CACHED);
        assertThat(attacher.isDirty()).isTrue();

        attacher.promote();
        UploadedFile stored = attacher.file();
        assertThat(stored.storageKey()).isEqualTo("store");
        assertThat(stored.metadata()).isEqualTo(cached.metadata());
        assertThat(stored.id()).isNotEqualTo(cached.id());
        assertThat(cache.exists(cached.id())).isFalse();
        assertThat(attacher.isStored()).isTrue();

        attacher.persist();
        assertThat(attacher.state()).isEqualTo(AttachmentState.persisted(stored));

        attacher.destroyAttached();
        assertThat(store.exists(stored.id())).isFalse();
    }

    @Test
    void replacing_a_persisted_file_deletes_it_only_on_persist() throws Exception {
        UploadedFile old = storedFile("old");
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", old);
        assertThat(attacher.isDirty()).isFalse();

        attacher.attach(text("new"), UploadContext.of("new.txt"));
        attacher.promote();
        assertThat(attacher.state().previous()).isEqualTo(old);
        assertThat(store.exists(old.id())).isTrue();

        attacher.persist();

        assertThat(store.exists(old.id())).isFalse();
        assertThat(store.exists(attacher.file().id())).isTrue();
        assertThat(attacher.state().previous()).isNull();
        assertThat(attacher.isDirty()).isFalse();
    }

    @Test
    void a_failed_save_keeps_the_old_file() throws Exception {
        UploadedFile old = storedFile("old");
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", old);

        attacher.attach(text("new"), UploadContext.of("new.txt"));
        attacher.promote();
        // record write fails here: persist is never called

        assertThat(store.exists(old.id())).isTrue();
        assertThat(store.exists(attacher.file().id())).isTrue();
    }

    @Test
    void attaching_twice_before_save_cleans_up_both_superseded_files() throws Exception {
        UploadedFile old = storedFile("old");
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", old);

        UploadedFile first = attacher.attach(text("first"), UploadContext.of("1.txt"));
        UploadedFile second = attacher.attach(text("second"), UploadContext.of("2.txt"));
        assertThat(attacher.state().previous()).isEqualTo(old);
        assertThat(cache.exists(first.id())).isTrue();

        attacher.promote();
        attacher.persist();

        assertThat(cache.exists(first.id())).isFalse();
        assertThat(cache.exists(second.id())).isFalse();
        assertThat(store.exists(old.id())).isFalse();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void failed_upload_changes_nothing() throws Exception {
        UploadedFile old = storedFile("old");
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", old);

        assertThatThrownBy(() -> attacher.attach(new ByteArrayInputStream(new byte[101]), UploadContext.empty()))
                .isInstanceOf(InvalidFileException.class);

        assertThat(attacher.state()).isEqualTo(AttachmentState.persisted(old));
        assertThat(cache.size()).isZero();
    }

    @Test
    void detach_then_persist_deletes_the_old_file() throws Exception {
        UploadedFile old = storedFile("old");
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", old);

        attacher.attach(null, UploadContext.empty());
        assertThat(attacher.file()).isNull();
        assertThat(attacher.status()).isEqualTo(AttachmentStatus.EMPTY);
        assertThat(attacher.isDirty()).isTrue();
        assertThat(store.exists(old.id())).isTrue();

        attacher.promote();
        attacher.persist();

        assertThat(store.exists(old.id())).isFalse();
    }

    @Test
    void detach_on_empty_is_a_no_op() {
        Attacher attacher = new Attacher(uploader);
        attacher.detach();
        assertThat(attacher.state()).isEqualTo(AttachmentState.empty());
    }

    @Test
    void promote_only_moves_cached_files() throws Exception {
        UploadedFile old = storedFile("old");
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", old);

        attacher.promote();
        assertThat(attacher.file()).isEqualTo(old);

        Attacher empty = new Attacher(uploader);
        assertThatCode(empty::promote).doesNotThrowAnyException();
        assertThat(empty.file()).isNull();
    }

    @Test
    void persist_when_clean_deletes_nothing() throws Exception {
        UploadedFile old = storedFile("old");
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", old);

        attacher.persist();

        assertThat(store.exists(old.id())).isTrue();
    }

    @Test
    void destroy_removes_current_and_pending_files() throws Exception {
        UploadedFile old = storedFile("old");
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", old);
        UploadedFile fresh = attacher.attach(text("fresh"), UploadContext.of("f.txt"));

        attacher.destroyAttached();

        assertThat(store.exists(old.id())).isFalse();
        assertThat(cache.exists(fresh.id())).isFalse();
    }

    @Test
    void destroy_tolerates_missing_objects() throws Exception {
        UploadedFile old = storedFile("old");
        store.delete(old.id());
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", old);

        assertThatCode(attacher::destroyAttached).doesNotThrowAnyException();
    }

    @Test
    void attachCached_reuses_a_cached_upload() throws Exception {
        UploadedFile cached = uploader.upload(text("from a redisplayed form"), "cache", UploadContext.of("a.txt"));
        Attacher attacher = new Attacher(uploader);

        attacher.attachCached(cached);

        assertThat(attacher.file()).isEqualTo(cached);
        assertThat(attacher.isCached()).isTrue();
        assertThat(attacher.isDirty()).isTrue();
    }

    @Test
    void attachCached_brings_back_a_superseded_upload() throws Exception {
        Attacher attacher = new Attacher(uploader);
        UploadedFile first = attacher.attach(text("first"), UploadContext.of("1.txt"));
        UploadedFile second = attacher.attach(text("second"), UploadContext.of("2.txt"));

        attacher.attachCached(first);
        attacher.persist();

        assertThat(attacher.file()).isEqualTo(first);
        assertThat(cache.exists(first.id())).isTrue();
        assertThat(cache.exists(second.id())).isFalse();
    }

    @Test
    void attachCached_restores_the_persisted_file() throws Exception {
        UploadedFile persisted = uploader.upload(text("kept in cache"), "cache", UploadContext.of("p.txt"));
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", persisted);
        UploadedFile replacement = attacher.attach(text("replacement"), UploadContext.of("r.txt"));

        attacher.attachCached(persisted);
        assertThat(attacher.state().previous()).isNull();
        attacher.persist();

        assertThat(cache.exists(persisted.id())).isTrue();
        assertThat(cache.exists(replacement.id())).isFalse();
    }

    @Test
    void promoting_a_persisted_cached_file_marks_the_attacher_dirty() throws Exception {
        UploadedFile persisted = uploader.upload(text("never promoted"), "cache", UploadContext.of("p.txt"));
        Attacher attacher = Attacher.fromPersisted(uploader, "cache", "store", persisted);

        attacher.promote();

        assertThat(attacher.isStored()).isTrue();
        assertThat(attacher.isDirty()).isTrue();
        assertThat(cache.exists(persisted.id())).isFalse();
        assertThat(store.exists(attacher.file().id())).isTrue();

        attacher.persist();
        assertThat(attacher.isDirty()).isFalse();
        assertThat(store.exists(attacher.file().id())).isTrue();
    }

    @Test
    void attachCached_rejects_foreign_or_missing_files() throws Exception {
        Attacher attacher = new Attacher(uploader);
        UploadedFile stored = storedFile("x");

        assertThatThrownBy(() -> attacher.attachCached(stored))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> attacher.attachCached(new UploadedFile("gone.txt", "cache", null)))
                .isInstanceOf(NoSuchFileException.class);
        assertThat(attacher.file()).isNull();
    }

    @Test
    void url_of_current_file() throws Exception {
        Attacher attacher = new Attacher(uploader);
        assertThat(attacher.url(Map.of())).isNull();

        UploadedFile file = attacher.attach(text("x"), UploadContext.of("x.txt"));

        assertThat(attacher.url(Map.of())).isEqualTo("memory://" + file.id());
    }

    @Test
    void custom_storage_keys_must_exist() {
        assertThatThrownBy(() -> new Attacher(uploader, "tmp", "store"))
                .isInstanceOf(StorageConfigurationException.class);
    }

    @Test
    void same_backend_for_cache_and_store() throws Exception {
        MemoryStorageAdapter shared = new MemoryStorageAdapter();
        StorageRegistry sharedStorages = StorageRegistry.builder().storage("cache", shared).storage("store", shared).build();
        Uploader sharedUploader = new Uploader(sharedStorages,
                MetadataExtractor.defaults(new TikaFileTypeDetector(), MimeTypeSource.CONTENT),
                new RandomLocationGenerator());
        Attacher attacher = new Attacher(sharedUploader);

        attacher.attach(text("x"), UploadContext.of("x.txt"));
        attacher.promote();
        attacher.persist();

        assertThat(attacher.isStored()).isTrue();
        assertThat(shared.size()).isEqualTo(1);
    }
}
