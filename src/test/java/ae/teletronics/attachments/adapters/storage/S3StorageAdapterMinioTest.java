package ae.teletronics.attachments.adapters.storage;

import ae.teletronics.attachments.adapters.AttachmentProperties;
import ae.teletronics.attachments.ports.StoredSource;
import ae.teletronics.attachments.ports.StreamSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MinIOContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the adapter against a real MinIO server; skipped when Docker isn't available.
 */
@Testcontainers(disabledWithoutDocker = true)
class S3StorageAdapterMinioTest {

    private static final String BUCKET = "attachments";

    @Container
    static final MinIOContainer MINIO = new MinIOContainer("minio/minio:RELEASE.2023-09-04T19-57-37Z");

    static S3Client s3;
    static S3Presigner presigner;

    @BeforeAll
    static void connect() {
        var storage = new AttachmentProperties.Storage(AttachmentProperties.StorageType.S3, null, null, false, null,
                BUCKET, "us-east-1", MINIO.getS3URL(), MINIO.getUserName(), MINIO.getPassword(), true);
        var factory = new StorageAdapterFactory();
        s3 = factory.s3Client(storage);
        presigner = factory.s3Presigner(storage);
        s3.createBucket(b -> b.bucket(BUCKET));
    }

    @AfterAll
    static void disconnect() {
        presigner.close();
        s3.close();
    }

    private static StreamSource text(String s) {
        return () -> new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private static String read(S3StorageAdapter adapter, String id) throws Exception {
        try (InputStream in = adapter.open(id)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void upload_open_delete() throws Exception {
        var adapter = new S3StorageAdapter(s3, presigner, BUCKET, "crud", null);

        adapter.upload(text("hello"), "a/b.txt", false);
        assertThat(adapter.exists("a/b.txt")).isTrue();
        assertThat(read(adapter, "a/b.txt")).isEqualTo("hello");

        adapter.delete("a/b.txt");
        adapter.delete("a/b.txt");
        assertThat(adapter.exists("a/b.txt")).isFalse();
        assertThatThrownBy(() -> adapter.open("a/b.txt")).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void multipart_upload_roundtrip() throws Exception {
        var adapter = new S3StorageAdapter(s3, presigner, BUCKET, "big", null);
        byte[] data = new byte[S3StorageAdapter.MULTIPART_CHUNK_SIZE * 2 + 17];
        for (int i = 0; i < data.length; i++) data[i] = (byte) i;

        adapter.upload(() -> new ByteArrayInputStream(data), "blob.bin", false);

        try (InputStream in = adapter.open("blob.bin")) {
            assertThat(in.readAllBytes()).isEqualTo(data);
        }
    }

    @Test
    void move_between_prefixes_of_one_bucket() throws Exception {
        var cache = new S3StorageAdapter(s3, presigner, BUCKET, "cache", null);
        var store = new S3StorageAdapter(s3, presigner, BUCKET, "store", null);
        cache.upload(text("promote me"), "x.txt", false);

        cache.upload(new StoredSource(cache, "x.txt"), "y.txt", true);
        store.upload(new StoredSource(cache, "y.txt"), "z.txt", true);

        assertThat(cache.exists("x.txt")).isFalse();
        assertThat(read(store, "z.txt")).isEqualTo("promote me");
    }

    @Test
    void deletePrefixed_only_touches_the_directory() throws Exception {
        var adapter = new S3StorageAdapter(s3, presigner, BUCKET, "prefixed", null);
        adapter.upload(text("1"), "a/1.txt", false);
        adapter.upload(text("2"), "a/b/2.txt", false);
        adapter.upload(text("3"), "ab/3.txt", false);

        adapter.deletePrefixed("a");

        assertThat(adapter.exists("a/1.txt")).isFalse();
        assertThat(adapter.exists("a/b/2.txt")).isFalse();
        assertThat(adapter.exists("ab/3.txt")).isTrue();
    }

    @Test
    void presigned_url_is_fetchable() throws Exception {
        var adapter = new S3StorageAdapter(s3, presigner, BUCKET, "signed", null);
        adapter.upload(text("signed content"), "s.txt", false);

        String url = adapter.url("s.txt", Map.of("expires_in", 60));

        HttpResponse<String> response = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create(url)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("signed content");
    }
}
