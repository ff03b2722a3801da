package ae.teletronics.attachments.adapters.detection;

import ae.teletronics.attachments.ports.FileTypeDetector;
import ae.teletronics.attachments.ports.StreamSource;
import org.apache.tika.Tika;
import org.apache.tika.config.TikaConfig;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Apache Tika-based file type detector: magic-byte sniffing for content, the glob database for
 * filename lookups.
 */
public class TikaFileTypeDetector implements FileTypeDetector {

    private final DefaultDetector detector;
    private final Tika byName;

    public TikaFileTypeDetector() {
        TikaConfig config = TikaConfig.getDefaultConfig();
        this.detector = new DefaultDetector(config.getMimeRepository());
        this.byName = new Tika(config);
    }

    @Override
    public Optional<String> detect(StreamSource source, String filenameHint) throws IOException {
        Metadata md = new Metadata();
        if (filenameHint != null && !filenameHint.isBlank()) {
            md.set(TikaCoreProperties.RESOURCE_NAME_KEY, filenameHint);
        }

        try (InputStream raw = source.openStream();
             TikaInputStream in = TikaInputStream.get(raw)) {
            in.mark(1);
            if (in.read() == -1) {
                return Optional.empty();
            }
            in.reset();
            return known(detector.detect(in, md));
        }
    }

    @Override
    public Optional<String> detectByName(String filename) {
        if (filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        String type = byName.detect(filename);
        return known(type == null ? null : MediaType.parse(type));
    }

    // Tika answers "application/octet-stream" when it doesn't know
    private static Optional<String> known(MediaType mediaType) {
        if (mediaType == null || MediaType.OCTET_STREAM.equals(mediaType)) {
            return Optional.empty();
        }
        return Optional.of(mediaType.getBaseType().toString());
    }
}
