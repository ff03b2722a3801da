package ae.teletronics.attachments.adapters.storage;

import ae.teletronics.attachments.ports.StoredSource;
import ae.teletronics.attachments.ports.StreamSource;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;

import static org.assertj.core.api.Assertions.*;

class MemoryStorageAdapterTest {

    private final MemoryStorageAdapter storage = new MemoryStorageAdapter();

    private static StreamSource text(String s) {
        return () -> new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private String read(String id) throws Exception {
        try (InputStream in = storage.open(id)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void upload_open_exists_delete() throws Exception {
        storage.upload(text("hello"), "a.txt", false);

        assertThat(storage.exists("a.txt")).isTrue();
        assertThat(read("a.txt")).isEqualTo("hello");

        storage.delete("a.txt");
        assertThat(storage.exists("a.txt")).isFalse();
        assertThatCode(() -> storage.delete("a.txt")).doesNotThrowAnyException();
    }

    @Test
    void open_missing_throws_NoSuchFile() {
        assertThatThrownBy(() -> storage.open("nope"))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void move_within_adapter_rekeys() throws Exception {
        storage.upload(text("x"), "from", false);

        storage.upload(new StoredSource(storage, "from"), "to", true);

        assertThat(storage.exists("from")).isFalse();
        assertThat(read("to")).isEqualTo("x");
        assertThat(storage.size()).isEqualTo(1);
    }

    @Test
    void move_of_missing_source_throws_NoSuchFile() {
        assertThatThrownBy(() -> storage.upload(new StoredSource(storage, "from"), "to", true))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void copy_without_move_keeps_source() throws Exception {
        storage.upload(text("x"), "from", false);

        storage.upload(new StoredSource(storage, "from"), "to", false);

        assertThat(storage.exists("from")).isTrue();
        assertThat(storage.exists("to")).isTrue();
    }

    @Test
    void deletePrefixed_treats_prefix_as_directory() throws Exception {
        storage.upload(text("1"), "a/1", false);
        storage.upload(text("2"), "a/b/2", false);
        storage.upload(text("3"), "ab/3", false);

        storage.deletePrefixed("a");

        assertThat(storage.exists("a/1")).isFalse();
        assertThat(storage.exists("a/b/2")).isFalse();
        assertThat(storage.exists("ab/3")).isTrue();
    }

    @Test
    void url_uses_memory_scheme() {
        assertThat(storage.url("k/x.png")).isEqualTo("memory://k/x.png");
    }

    @Test
    void clear_drops_everything() throws Exception {
        storage.upload(text("1"), "a", false);
        storage.upload(text("2"), "b", false);

        storage.clear();

        assertThat(storage.size()).isZero();
    }
}
