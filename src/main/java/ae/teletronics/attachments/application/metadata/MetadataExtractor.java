package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.FileTypeDetector;
import ae.teletronics.attachments.ports.StreamSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, immutable pipeline of {@link MetadataAnalyzer}s. Running it is also the validation
 * checkpoint of an upload: it happens before anything is written to storage.
 */
public final class MetadataExtractor {

    private final List<MetadataAnalyzer> analyzers;

    public MetadataExtractor(List<MetadataAnalyzer> analyzers) {
        this.analyzers = List.copyOf(analyzers);
    }

    /** Size, filename and MIME type, in that order. */
    public static MetadataExtractor defaults(FileTypeDetector detector, MimeTypeSource mimeTypeSource) {
        return new MetadataExtractor(List.of(
                new SizeAnalyzer(),
                new FilenameAnalyzer(),
                new MimeTypeAnalyzer(detector, mimeTypeSource)));
    }

    /** A copy with {@code analyzer} appended. */
    public MetadataExtractor with(MetadataAnalyzer analyzer) {
        Objects.requireNonNull(analyzer, "analyzer");
        List<MetadataAnalyzer> copy = new ArrayList<>(analyzers);
        copy.add(analyzer);
        return new MetadataExtractor(copy);
    }

    /**
     * A copy with a custom field: {@code value} is computed per upload and stored under {@code name},
     * or merged in when it returns a map.
     */
    public MetadataExtractor withField(String name, ValueFunction value) {
        Objects.requireNonNull(name, "name");
        return with((source, context, metadata) -> {
            Object result = value.compute(source, context);
            if (result instanceof Map<?, ?> map) {
                map.forEach((k, v) -> metadata.put(String.valueOf(k), v));
            } else {
                metadata.put(name, result);
            }
        });
    }

    public List<MetadataAnalyzer> analyzers() {
        return analyzers;
    }

    public FileMetadata extract(StreamSource source, UploadContext context) throws IOException {
        Objects.requireNonNull(source, "source");
        UploadContext ctx = context == null ? UploadContext.empty() : context;
        FileMetadata.Builder metadata = FileMetadata.builder();
        for (MetadataAnalyzer analyzer : analyzers) {
            analyzer.analyze(source, ctx, metadata);
        }
        return metadata.build();
    }

    @FunctionalInterface
    public interface ValueFunction {
        Object compute(StreamSource source, UploadContext context) throws IOException;
    }
}
