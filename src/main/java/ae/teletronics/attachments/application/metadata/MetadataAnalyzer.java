package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.StreamSource;

import java.io.IOException;

/**
 * One step of metadata extraction.
 *
 * Implementations open their own stream from {@code source}, so every analyzer reads the upload
 * from the start. They add fields to {@code metadata} (which already holds what earlier analyzers
 * found) or reject the upload by throwing
 * {@link ae.teletronics.attachments.application.exceptions.InvalidFileException}.
 */
@FunctionalInterface
public interface MetadataAnalyzer {

    void analyze(StreamSource source, UploadContext context, FileMetadata.Builder metadata) throws IOException;
}
