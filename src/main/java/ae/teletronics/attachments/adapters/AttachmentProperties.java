package ae.teletronics.attachments.adapters;

import ae.teletronics.attachments.application.metadata.MimeTypeSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "attachments")
public record AttachmentProperties(
        @DefaultValue("cache") String cacheKey,
        @DefaultValue("store") String storeKey,
        Map<String, Storage> storages,
        @DefaultValue("content") MimeTypeSource mimeTypeSource,
        @DefaultValue("false") boolean checksum,
        @DefaultValue("false") boolean dimensions,
        @DefaultValue("false") boolean virusScan,
        @DefaultValue Validation validation,
        @DefaultValue Location location
) {

    public AttachmentProperties {
        storages = storages == null ? Map.of() : storages;
    }

    public enum StorageType { MEMORY, FILESYSTEM, S3 }

    /**
     * One backend. Filesystem uses basePath/prefix; S3 uses bucket/prefix and the connection settings.
     */
    public record Storage(
            @DefaultValue("filesystem") StorageType type,
            String basePath,
            String prefix,
            @DefaultValue("false") boolean fsyncOnWrite,
            String publicBaseUrl,
            String bucket,
            @DefaultValue("us-east-1") String region,
            String endpoint,
            String accessKey,
            String secretKey,
            @DefaultValue("true") boolean pathStyle
    ) {
    }

    public record Validation(
            Long maxSize,
            Long minSize,
            List<String> allowedTypes,
            List<String> rejectedTypes
    ) {
        public Validation {
            allowedTypes = allowedTypes == null ? List.of() : allowedTypes;
            rejectedTypes = rejectedTypes == null ? List.of() : rejectedTypes;
        }
    }

    public enum LocationStrategy { RANDOM, DATE }

    public record Location(@DefaultValue("random") LocationStrategy strategy) {
    }
}
