package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.application.util.Hashing;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.StreamSource;

import java.io.IOException;
import java.util.Locale;

/**
 * Hex digest of the content, stored under the lower-cased algorithm name without dashes
 * ("sha256", "md5").
 */
public class ChecksumAnalyzer implements MetadataAnalyzer {

    private final String algorithm;
    private final String field;

    public ChecksumAnalyzer() {
        this(Hashing.SHA_256);
    }

    public ChecksumAnalyzer(String algorithm) {
        this.algorithm = algorithm;
        this.field = algorithm.replace("-", "").toLowerCase(Locale.ROOT);
    }

    public String field() {
        return field;
    }

    @Override
    public void analyze(StreamSource source, UploadContext context, FileMetadata.Builder metadata) throws IOException {
        metadata.put(field, Hashing.hex(source, algorithm));
    }
}
