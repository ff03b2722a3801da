package ae.teletronics.attachments.application;

import java.util.HashMap;
import java.util.Map;

/**
 * What the caller knows about an upload besides its bytes.
 *
 * @param filename    original filename, may be null
 * @param contentType content type claimed by the client, may be null
 * @param attributes  free-form values for custom analyzers and location generators
 */
public record UploadContext(String filename, String contentType, Map<String, Object> attributes) {

    private static final UploadContext EMPTY = new UploadContext(null, null, Map.of());

    public UploadContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static UploadContext empty() {
        return EMPTY;
    }

    public static UploadContext of(String filename) {
        return new UploadContext(filename, null, Map.of());
    }

    public static UploadContext of(String filename, String contentType) {
        return new UploadContext(filename, contentType, Map.of());
    }

    public UploadContext withAttribute(String key, Object value) {
        Map<String, Object> copy = new HashMap<>(attributes);
        copy.put(key, value);
        return new UploadContext(filename, contentType, copy);
    }
}
