package ae.teletronics.attachments.adapters.storage;

import ae.teletronics.attachments.adapters.AttachmentProperties;
import ae.teletronics.attachments.application.exceptions.StorageConfigurationException;
import ae.teletronics.attachments.ports.StoragePort;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Turns a storage definition from configuration into a {@link StoragePort}.
 */
public class StorageAdapterFactory {

    public StoragePort create(String key, AttachmentProperties.Storage storage) {
        if (storage == null || storage.type() == null) {
            throw new StorageConfigurationException("Storage '" + key + "' has no type");
        }
        switch (storage.type()) {
            case MEMORY:
                return new MemoryStorageAdapter();
            case FILESYSTEM:
                return fileSystem(key, storage);
            case S3:
                return s3(key, storage);
            default:
                throw new StorageConfigurationException("Unsupported storage type " + storage.type() + " for '" + key + "'");
        }
    }

    private StoragePort fileSystem(String key, AttachmentProperties.Storage storage) {
        if (storage.basePath() == null || storage.basePath().isBlank()) {
            throw new StorageConfigurationException("Storage '" + key + "' needs a base-path");
        }
        Path root = Paths.get(storage.basePath()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create storage directory " + root, e);
        }
        return new LocalFsStorageAdapter(root, storage.prefix(), storage.fsyncOnWrite(), storage.publicBaseUrl());
    }

    private StoragePort s3(String key, AttachmentProperties.Storage storage) {
        if (storage.bucket() == null || storage.bucket().isBlank()) {
            throw new StorageConfigurationException("Storage '" + key + "' needs a bucket");
        }
        return new S3StorageAdapter(s3Client(storage), s3Presigner(storage),
                storage.bucket(), storage.prefix(), storage.publicBaseUrl());
    }

    S3Client s3Client(AttachmentProperties.Storage storage) {
        var builder = S3Client.builder()
                .httpClient(UrlConnectionHttpClient.create())
                .region(Region.of(storage.region()))
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(storage.pathStyle()).build());

        if (storage.endpoint() != null && !storage.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(storage.endpoint()));
        }

        if (storage.accessKey() != null && !storage.accessKey().isBlank()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(storage.accessKey(), storage.secretKey())));
        }

        return builder.build();
    }

    S3Presigner s3Presigner(AttachmentProperties.Storage storage) {
        var builder = S3Presigner.builder()
                .region(Region.of(storage.region()))
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(storage.pathStyle()).build());

        if (storage.endpoint() != null && !storage.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(storage.endpoint()));
        }

        if (storage.accessKey() != null && !storage.accessKey().isBlank()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(storage.accessKey(), storage.secretKey())));
        }

        return builder.build();
    }
}
