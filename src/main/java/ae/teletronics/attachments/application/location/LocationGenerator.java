package ae.teletronics.attachments.application.location;

import ae.teletronics.attachments.domain.model.FileMetadata;

/**
 * Produces the backend-relative id for a new object. Override point for callers that want
 * structured paths.
 *
 * Implementations must never hand out an id twice.
 */
@FunctionalInterface
public interface LocationGenerator {

    /**
     * @param metadata  metadata of the object being written
     * @param extension extension to keep (without the dot), or null
     */
    String generate(FileMetadata metadata, String extension);

    static String withExtension(String base, String extension) {
        return extension == null || extension.isBlank() ? base : base + "." + extension;
    }
}
