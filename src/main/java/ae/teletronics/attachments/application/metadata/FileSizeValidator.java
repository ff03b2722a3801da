package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.application.exceptions.InvalidFileException;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.StreamSource;

/**
 * Rejects uploads outside [minimum, maximum] bytes. Place it after {@link SizeAnalyzer}.
 */
public class FileSizeValidator implements MetadataAnalyzer {

    private final Long minimum;
    private final Long maximum;

    /**
     * @param minimum inclusive lower bound, null for none
     * @param maximum inclusive upper bound, null for none
     */
    public FileSizeValidator(Long minimum, Long maximum) {
        if (minimum != null && maximum != null && minimum > maximum) {
            throw new IllegalArgumentException("minimum " + minimum + " exceeds maximum " + maximum);
        }
        this.minimum = minimum;
        this.maximum = maximum;
    }

    public static FileSizeValidator atMost(long maximum) {
        return new FileSizeValidator(null, maximum);
    }

    @Override
    public void analyze(StreamSource source, UploadContext context, FileMetadata.Builder metadata) {
        Long size = metadata.size();
        if (size == null) return;
        if (maximum != null && size > maximum) {
            throw new InvalidFileException("is too large (maximum is " + maximum + " bytes)");
        }
        if (minimum != null && size < minimum) {
            throw new InvalidFileException("is too small (minimum is " + minimum + " bytes)");
        }
    }
}
