package ae.teletronics.attachments.adapters;

import ae.teletronics.attachments.adapters.antivirus.NoOpVirusScanner;
import ae.teletronics.attachments.adapters.detection.TikaFileTypeDetector;
import ae.teletronics.attachments.adapters.storage.StorageAdapterFactory;
import ae.teletronics.attachments.adapters.time.SystemClockProvider;
import ae.teletronics.attachments.application.StorageRegistry;
import ae.teletronics.attachments.ports.ClockProvider;
import ae.teletronics.attachments.ports.FileTypeDetector;
import ae.teletronics.attachments.ports.VirusScanner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AttachmentProperties.class)
public class AdaptersConfig {

    @Bean
    @ConditionalOnMissingBean(StorageAdapterFactory.class)
    public StorageAdapterFactory storageAdapterFactory() {
        return new StorageAdapterFactory();
    }

    @Bean
    @ConditionalOnMissingBean(StorageRegistry.class)
    public StorageRegistry storageRegistry(AttachmentProperties properties, StorageAdapterFactory factory) {
        StorageRegistry.Builder registry = StorageRegistry.builder();
        properties.storages().forEach((key, storage) -> registry.storage(key, factory.create(key, storage)));
        return registry.build();
    }

    @Bean
    @ConditionalOnMissingBean(FileTypeDetector.class)
    public FileTypeDetector fileTypeDetector() {
        return new TikaFileTypeDetector();
    }

    @Bean
    @ConditionalOnMissingBean(VirusScanner.class)
    public VirusScanner virusScanner() {
        return new NoOpVirusScanner();
    }

    @Bean
    @ConditionalOnMissingBean(ClockProvider.class)
    public ClockProvider clockProvider() {
        return new SystemClockProvider();
    }
}
