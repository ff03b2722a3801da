package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.FileTypeDetector;
import ae.teletronics.attachments.ports.StreamSource;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

public class MimeTypeAnalyzer implements MetadataAnalyzer {

    private static final String OCTET_STREAM = "application/octet-stream";

    private final FileTypeDetector detector;
    private final MimeTypeSource source;

    public MimeTypeAnalyzer(FileTypeDetector detector, MimeTypeSource source) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public void analyze(StreamSource content, UploadContext context, FileMetadata.Builder metadata) throws IOException {
        metadata.mimeType(determine(content, context));
    }

    String determine(StreamSource content, UploadContext context) throws IOException {
        switch (source) {
            case CONTENT:
                return detector.detect(content, context.filename()).orElse(null);
            case EXTENSION:
                return detector.detectByName(context.filename()).orElse(null);
            case HEADER:
                // octet-stream is what clients send when they don't know either
                String header = context.contentType();
                if (!StringUtils.hasText(header) || OCTET_STREAM.equalsIgnoreCase(header.trim())) {
                    return null;
                }
                int params = header.indexOf(';');
                return (params >= 0 ? header.substring(0, params) : header).trim().toLowerCase(Locale.ROOT);
            default:
                throw new IllegalStateException("Unhandled MIME type source " + source);
        }
    }
}
