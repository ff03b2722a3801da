package ae.teletronics.attachments.ports;

import java.io.IOException;
import java.util.Optional;

/**
 * Determines the media type (e.g., "image/png") from bytes or from a filename.
 * Should not assume the stream supports mark/reset; always use the provided StreamSource.
 */
public interface FileTypeDetector {

    /**
     * Sniff the content.
     *
     * @param source        re-openable source to inspect
     * @param filenameHint  optional filename to help detection (e.g., extension)
     * @return Optional content type (RFC 2046, e.g., "application/pdf"), empty for empty input
     */
    Optional<String> detect(StreamSource source, String filenameHint) throws IOException;

    /**
     * Look the type up by filename extension only.
     *
     * @return empty for a missing filename or an unknown extension
     */
    Optional<String> detectByName(String filename);
}
