package ae.teletronics.attachments.application;

import ae.teletronics.attachments.adapters.storage.MemoryStorageAdapter;
import ae.teletronics.attachments.application.exceptions.StorageConfigurationException;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.domain.model.UploadedFile;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StorageRegistryTest {

    private final MemoryStorageAdapter cache = new MemoryStorageAdapter();
    private final StorageRegistry registry = StorageRegistry.builder()
            .storage("cache", cache)
            .storage("store", new MemoryStorageAdapter())
            .build();

    @Test
    void resolves_configured_keys_in_order() {
        assertThat(registry.keys()).containsExactly("cache", "store");
        assertThat(registry.resolve("cache")).isSameAs(cache);
        assertThat(registry.contains("store")).isTrue();
        assertThat(registry.contains("other")).isFalse();
    }

    @Test
    void unknown_key_is_a_configuration_error() {
        assertThatThrownBy(() -> registry.resolve("other"))
                .isInstanceOf(StorageConfigurationException.class)
                .hasMessage("Unknown storage 'other' (configured: [cache, store])");
        assertThatThrownBy(() -> registry.require("cache", "other"))
                .isInstanceOf(StorageConfigurationException.class);
    }

    @Test
    void blank_keys_and_missing_backends_are_rejected() {
        assertThatThrownBy(() -> StorageRegistry.builder().storage(" ", cache).build())
                .isInstanceOf(StorageConfigurationException.class);
        assertThatThrownBy(() -> StorageRegistry.builder().storage("cache", null).build())
                .isInstanceOf(StorageConfigurationException.class);
    }

    @Test
    void keys_are_read_only() {
        assertThatThrownBy(() -> registry.keys().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void file_operations_go_to_the_files_backend() throws Exception {
        cache.upload(() -> new ByteArrayInputStream("data".getBytes()), "ab.txt", false);
        UploadedFile file = new UploadedFile("ab.txt", "cache", FileMetadata.empty());

        assertThat(registry.exists(file)).isTrue();
        assertThat(registry.url(file, null)).isEqualTo("memory://ab.txt");
        try (var in = registry.open(file)) {
            assertThat(in.readAllBytes()).isEqualTo("data".getBytes());
        }

        Path downloaded = registry.download(file);
        try {
            assertThat(downloaded.getFileName().toString()).endsWith(".txt");
            assertThat(Files.readString(downloaded)).isEqualTo("data");
        } finally {
            Files.deleteIfExists(downloaded);
        }

        registry.delete(file);
        assertThat(registry.exists(file)).isFalse();
    }

    @Test
    void download_of_missing_file_fails() {
        UploadedFile file = new UploadedFile("gone", "store", FileMetadata.empty());
        assertThatThrownBy(() -> registry.download(file)).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void url_options_pass_through() {
        UploadedFile file = new UploadedFile("x", "store", FileMetadata.empty());
        assertThat(registry.url(file, Map.of("expires_in", 10))).isEqualTo("memory://x");
    }
}
