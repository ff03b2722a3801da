package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.application.exceptions.InvalidFileException;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.StreamSource;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;

/**
 * Adds "width" and "height" for images, reading only the image header.
 * Runs after MIME detection and skips anything that isn't an {@code image/*}.
 */
public class ImageDimensionsAnalyzer implements MetadataAnalyzer {

    public static final String WIDTH = "width";
    public static final String HEIGHT = "height";

    private final boolean required;

    public ImageDimensionsAnalyzer() {
        this(false);
    }

    /**
     * @param required reject images whose dimensions can't be read instead of leaving them out
     */
    public ImageDimensionsAnalyzer(boolean required) {
        this.required = required;
    }

    @Override
    public void analyze(StreamSource source, UploadContext context, FileMetadata.Builder metadata) throws IOException {
        String mimeType = metadata.mimeType();
        if (mimeType == null || !mimeType.startsWith("image/")) {
            return;
        }
        int[] dimensions = dimensions(source);
        if (dimensions == null) {
            if (required) {
                throw new InvalidFileException("image dimensions could not be determined");
            }
            return;
        }
        metadata.put(WIDTH, dimensions[0]);
        metadata.put(HEIGHT, dimensions[1]);
    }

    /** {width, height}, or null when no reader understands the data. */
    static int[] dimensions(StreamSource source) throws IOException {
        try (InputStream in = source.openStream();
             ImageInputStream images = ImageIO.createImageInputStream(in)) {
            if (images == null) return null;
            Iterator<ImageReader> readers = ImageIO.getImageReaders(images);
            if (!readers.hasNext()) return null;
            ImageReader reader = readers.next();
            try {
                reader.setInput(images, true, true);
                return new int[]{reader.getWidth(0), reader.getHeight(0)};
            } catch (IIOException e) {
                // truncated or corrupt header
                return null;
            } finally {
                reader.dispose();
            }
        }
    }
}
