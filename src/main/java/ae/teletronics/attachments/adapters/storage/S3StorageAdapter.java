package ae.teletronics.attachments.adapters.storage;

import ae.teletronics.attachments.ports.StoragePort;
import ae.teletronics.attachments.ports.StoredSource;
import ae.teletronics.attachments.ports.StreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * S3-backed storage. Ids are object keys below an optional key prefix in one bucket.
 *
 * <p>Objects up to 5 MB are written with a single {@code PutObject}; larger ones are streamed as a
 * multipart upload in 5 MB parts, which S3 only makes visible on completion and which is aborted
 * on failure. Moves inside the same adapter are done server-side (copy, then delete).
 */
public class S3StorageAdapter implements StoragePort {

    private static final Logger log = LoggerFactory.getLogger(S3StorageAdapter.class);

    // S3 multipart upload minimum part size is 5 MB (except the last part)
    static final int MULTIPART_CHUNK_SIZE = 5 * 1024 * 1024;
    private static final int DELETE_BATCH_SIZE = 1000;

    /** URL option forwarded to signed URLs as the response Content-Disposition. */
    public static final String RESPONSE_CONTENT_DISPOSITION = "response_content_disposition";

    private final S3Client s3;
    private final S3Presigner presigner;
    private final String bucket;
    private final String prefix;
    private final String publicBaseUrl;

    public S3StorageAdapter(S3Client s3, S3Presigner presigner, String bucket) {
        this(s3, presigner, bucket, null, null);
    }

    public S3StorageAdapter(S3Client s3, S3Presigner presigner, String bucket, String prefix, String publicBaseUrl) {
        this.s3 = Objects.requireNonNull(s3, "s3");
        this.presigner = presigner;
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("bucket is required");
        }
        this.bucket = bucket;
        this.prefix = prefix == null || prefix.isBlank() ? null : StoragePort.directoryPrefix(prefix);
        this.publicBaseUrl = publicBaseUrl == null || publicBaseUrl.isBlank()
                ? null
                : publicBaseUrl.trim().replaceAll("/+$", "");
    }

    public String bucket() {
        return bucket;
    }

    String key(String id) {
        return prefix == null ? id : prefix + id;
    }

    @Override
    public void upload(StreamSource source, String id, boolean move) throws IOException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(id, "id");
        try {
            if (move && source instanceof StoredSource stored && stored.isIn(this)) {
                try {
                    copyThenDelete(stored.id(), id);
                } catch (NoSuchKeyException e) {
                    throw notFound(stored.id(), e);
                }
                return;
            }
            try (InputStream in = source.openStream()) {
                byte[] first = in.readNBytes(MULTIPART_CHUNK_SIZE);
                if (first.length < MULTIPART_CHUNK_SIZE) {
                    s3.putObject(PutObjectRequest.builder()
                                    .bucket(bucket)
                                    .key(key(id))
                                    .contentLength((long) first.length)
                                    .build(),
                            RequestBody.fromBytes(first));
                } else {
                    multipartUpload(in, first, key(id));
                }
            }
            log.debug("Stored s3://{}/{}", bucket, key(id));
        } catch (SdkException e) {
            throw new IOException("Failed to store to S3: " + id, e);
        }
    }

    private void copyThenDelete(String fromId, String toId) {
        s3.copyObject(CopyObjectRequest.builder()
                .sourceBucket(bucket)
                .sourceKey(key(fromId))
                .destinationBucket(bucket)
                .destinationKey(key(toId))
                .build());
        s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key(fromId)).build());
        log.debug("Moved s3://{}/{} -> {}", bucket, key(fromId), key(toId));
    }

    private void multipartUpload(InputStream in, byte[] first, String s3Key) throws IOException {
        String uploadId = s3.createMultipartUpload(CreateMultipartUploadRequest.builder()
                        .bucket(bucket)
                        .key(s3Key)
                        .build())
                .uploadId();

        List<CompletedPart> parts = new ArrayList<>();
        int partNumber = 1;
        try {
            byte[] chunk = first;
            while (chunk.length > 0) {
                parts.add(uploadPart(s3Key, uploadId, partNumber++, chunk));
                chunk = in.readNBytes(MULTIPART_CHUNK_SIZE);
            }
            s3.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                    .bucket(bucket)
                    .key(s3Key)
                    .uploadId(uploadId)
                    .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
                    .build());
        } catch (IOException | RuntimeException e) {
            try {
                s3.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                        .bucket(bucket)
                        .key(s3Key)
                        .uploadId(uploadId)
                        .build());
            } catch (SdkException abortEx) {
                log.warn("Failed to abort multipart upload {}: {}", uploadId, abortEx.getMessage());
                e.addSuppressed(abortEx);
            }
            throw e;
        }
    }

    private CompletedPart uploadPart(String s3Key, String uploadId, int partNumber, byte[] data) {
        var response = s3.uploadPart(UploadPartRequest.builder()
                        .bucket(bucket)
                        .key(s3Key)
                        .uploadId(uploadId)
                        .partNumber(partNumber)
                        .contentLength((long) data.length)
                        .build(),
                RequestBody.fromBytes(data));
        return CompletedPart.builder().partNumber(partNumber).eTag(response.eTag()).build();
    }

    @Override
    public InputStream open(String id) throws IOException {
        try {
            return s3.getObject(GetObjectRequest.builder().bucket(bucket).key(key(id)).build());
        } catch (NoSuchKeyException e) {
            throw notFound(id, e);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) throw notFound(id, e);
            throw new IOException("Failed to retrieve from S3: " + id, e);
        } catch (SdkException e) {
            throw new IOException("Failed to retrieve from S3: " + id, e);
        }
    }

    @Override
    public boolean exists(String id) throws IOException {
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key(id)).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) return false;
            throw new IOException("Failed to check S3 object: " + id, e);
        } catch (SdkException e) {
            throw new IOException("Failed to check S3 object: " + id, e);
        }
    }

    @Override
    public void delete(String id) throws IOException {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key(id)).build());
            log.debug("Deleted s3://{}/{}", bucket, key(id));
        } catch (SdkException e) {
            throw new IOException("Failed to delete S3 object: " + id, e);
        }
    }

    @Override
    public void deletePrefixed(String prefix) throws IOException {
        String keyPrefix = key(StoragePort.directoryPrefix(prefix));
        try {
            List<ObjectIdentifier> batch = new ArrayList<>();
            var pages = s3.listObjectsV2Paginator(ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(keyPrefix)
                    .build());
            for (S3Object object : pages.contents()) {
                batch.add(ObjectIdentifier.builder().key(object.key()).build());
                if (batch.size() == DELETE_BATCH_SIZE) {
                    deleteBatch(batch);
                    batch.clear();
                }
            }
            if (!batch.isEmpty()) {
                deleteBatch(batch);
            }
        } catch (SdkException e) {
            throw new IOException("Failed to delete S3 prefix: " + keyPrefix, e);
        }
    }

    private void deleteBatch(List<ObjectIdentifier> batch) {
        s3.deleteObjects(DeleteObjectsRequest.builder()
                .bucket(bucket)
                .delete(Delete.builder().objects(new ArrayList<>(batch)).quiet(true).build())
                .build());
        log.debug("Deleted {} objects from s3://{}", batch.size(), bucket);
    }

    /**
     * Signed URL when {@value StoragePort#EXPIRES_IN} (seconds) is given, otherwise the public
     * base URL or the plain S3 object URL.
     */
    @Override
    public String url(String id, Map<String, ?> options) {
        Object expiresIn = options == null ? null : options.get(EXPIRES_IN);
        if (expiresIn != null && presigner != null) {
            GetObjectRequest.Builder get = GetObjectRequest.builder().bucket(bucket).key(key(id));
            Object disposition = options.get(RESPONSE_CONTENT_DISPOSITION);
            if (disposition != null) {
                get.responseContentDisposition(disposition.toString());
            }
            return presigner.presignGetObject(GetObjectPresignRequest.builder()
                            .signatureDuration(Duration.ofSeconds(seconds(expiresIn)))
                            .getObjectRequest(get.build())
                            .build())
                    .url()
                    .toString();
        }
        if (publicBaseUrl != null) {
            return publicBaseUrl + "/" + key(id);
        }
        return s3.utilities().getUrl(GetUrlRequest.builder().bucket(bucket).key(key(id)).build()).toString();
    }

    private static long seconds(Object value) {
        if (value instanceof Duration d) return d.getSeconds();
        if (value instanceof Number n) return n.longValue();
        return Long.parseLong(value.toString().trim());
    }

    private static NoSuchFileException notFound(String id, Exception cause) {
        NoSuchFileException e = new NoSuchFileException(id, null, "object not found on S3");
        e.initCause(cause);
        return e;
    }
}
