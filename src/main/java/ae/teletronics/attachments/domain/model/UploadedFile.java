package ae.teletronics.attachments.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable reference to one stored object.
 *
 * {@code id} is relative to the backend registered under {@code storageKey}. Two references are
 * equal when they point at the same object; metadata is informational only.
 */
@JsonPropertyOrder({"id", "storage_key", "metadata"})
public final class UploadedFile {

    private final String id;
    private final String storageKey;
    private final FileMetadata metadata;

    @JsonCreator
    public UploadedFile(@JsonProperty("id") String id,
                        @JsonProperty("storage_key") String storageKey,
                        @JsonProperty("metadata") FileMetadata metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.storageKey = Objects.requireNonNull(storageKey, "storageKey");
        this.metadata = metadata == null ? FileMetadata.empty() : metadata;
    }

    @JsonProperty("id")
    public String id() { return id; }

    @JsonProperty("storage_key")
    public String storageKey() { return storageKey; }

    @JsonProperty("metadata")
    public FileMetadata metadata() { return metadata; }

    @JsonIgnore
    public Long size() { return metadata.size(); }

    @JsonIgnore
    public String mimeType() { return metadata.mimeType(); }

    @JsonIgnore
    public String originalFilename() { return metadata.filename(); }

    /**
     * Lower-cased extension taken from the id, else from the original filename.
     * Empty when neither carries one.
     */
    @JsonIgnore
    public Optional<String> extension() {
        Optional<String> fromId = extensionOf(id);
        return fromId.isPresent() ? fromId : extensionOf(originalFilename());
    }

    /**
     * Extension of the last path segment of {@code name}, without the dot.
     * Dotfiles ({@code .bashrc}) and trailing dots ({@code file.}) have none.
     */
    public static Optional<String> extensionOf(String name) {
        if (name == null) return Optional.empty();
        String segment = name.replace('\\', '/');
        int slash = segment.lastIndexOf('/');
        if (slash >= 0) segment = segment.substring(slash + 1);
        int dot = segment.lastIndexOf('.');
        if (dot <= 0 || dot == segment.length() - 1) return Optional.empty();
        return Optional.of(segment.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /** Same object coordinates with different metadata. */
    public UploadedFile withMetadata(FileMetadata metadata) {
        return new UploadedFile(id, storageKey, metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UploadedFile)) return false;
        UploadedFile that = (UploadedFile) o;
        return id.equals(that.id) && storageKey.equals(that.storageKey);
    }

    @Override
    public int hashCode() { return Objects.hash(id, storageKey); }

    @Override
    public String toString() {
        return "UploadedFile{" +
                "id='" + id + '\'' +
                ", storageKey='" + storageKey + '\'' +
                ", metadata=" + metadata +
                '}';
    }
}
