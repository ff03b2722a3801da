package ae.teletronics.attachments.adapters;

import ae.teletronics.attachments.application.AttachmentDataCodec;
import ae.teletronics.attachments.application.AttachmentFieldFactory;
import ae.teletronics.attachments.application.StorageRegistry;
import ae.teletronics.attachments.application.Uploader;
import ae.teletronics.attachments.application.location.DatePartitionedLocationGenerator;
import ae.teletronics.attachments.application.location.LocationGenerator;
import ae.teletronics.attachments.application.location.RandomLocationGenerator;
import ae.teletronics.attachments.application.metadata.ChecksumAnalyzer;
import ae.teletronics.attachments.application.metadata.ContentTypeValidator;
import ae.teletronics.attachments.application.metadata.FileSizeValidator;
import ae.teletronics.attachments.application.metadata.ImageDimensionsAnalyzer;
import ae.teletronics.attachments.application.metadata.MetadataExtractor;
import ae.teletronics.attachments.application.metadata.VirusScanAnalyzer;
import ae.teletronics.attachments.ports.ClockProvider;
import ae.teletronics.attachments.ports.FileTypeDetector;
import ae.teletronics.attachments.ports.VirusScanner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Upload pipeline and attachment fields, assembled from {@link AttachmentProperties}.
 */
@Configuration
@Import(AdaptersConfig.class)
public class AttachmentsConfig {

    @Bean
    @ConditionalOnMissingBean(MetadataExtractor.class)
    public MetadataExtractor metadataExtractor(AttachmentProperties properties,
                                               FileTypeDetector detector,
                                               VirusScanner virusScanner) {
        MetadataExtractor extractor = MetadataExtractor.defaults(detector, properties.mimeTypeSource());
        if (properties.virusScan()) {
            extractor = extractor.with(new VirusScanAnalyzer(virusScanner));
        }
        AttachmentProperties.Validation validation = properties.validation();
        if (validation.maxSize() != null || validation.minSize() != null) {
            extractor = extractor.with(new FileSizeValidator(validation.minSize(), validation.maxSize()));
        }
        if (!validation.allowedTypes().isEmpty() || !validation.rejectedTypes().isEmpty()) {
            extractor = extractor.with(new ContentTypeValidator(validation.allowedTypes(), validation.rejectedTypes()));
        }
        if (properties.checksum()) {
            extractor = extractor.with(new ChecksumAnalyzer());
        }
        if (properties.dimensions()) {
            extractor = extractor.with(new ImageDimensionsAnalyzer());
        }
        return extractor;
    }

    @Bean
    @ConditionalOnMissingBean(LocationGenerator.class)
    public LocationGenerator locationGenerator(AttachmentProperties properties, ClockProvider clock) {
        if (properties.location().strategy() == AttachmentProperties.LocationStrategy.DATE) {
            return new DatePartitionedLocationGenerator(clock);
        }
        return new RandomLocationGenerator();
    }

    @Bean
    @ConditionalOnMissingBean(Uploader.class)
    public Uploader uploader(AttachmentProperties properties,
                             StorageRegistry storages,
                             MetadataExtractor extractor,
                             LocationGenerator locations) {
        Long maxSize = properties.validation().maxSize();
        return new Uploader(storages, extractor, locations, maxSize == null ? Long.MAX_VALUE : maxSize);
    }

    @Bean
    @ConditionalOnMissingBean(AttachmentDataCodec.class)
    public AttachmentDataCodec attachmentDataCodec() {
        return new AttachmentDataCodec();
    }

    @Bean
    @ConditionalOnMissingBean(AttachmentFieldFactory.class)
    public AttachmentFieldFactory attachmentFieldFactory(AttachmentProperties properties,
                                                         Uploader uploader,
                                                         AttachmentDataCodec codec) {
        return new AttachmentFieldFactory(uploader, codec, properties.cacheKey(), properties.storeKey());
    }
}
