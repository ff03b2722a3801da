package ae.teletronics.attachments.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Metadata extracted from an upload.
 *
 * Well-known fields are typed and always serialized (absent ones as explicit nulls) so that a
 * persisted reference reads back equal. Analyzer-contributed fields live in {@link #extra()} and
 * are flattened next to the well-known ones in JSON.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"size", "mime_type", "filename"})
public final class FileMetadata {

    public static final String SIZE = "size";
    public static final String MIME_TYPE = "mime_type";
    public static final String FILENAME = "filename";

    private static final FileMetadata EMPTY = new FileMetadata(null, null, null, Map.of());

    private final Long size;
    private final String mimeType;
    private final String filename;
    private final Map<String, Object> extra;

    private FileMetadata(Long size, String mimeType, String filename, Map<String, Object> extra) {
        if (size != null && size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        this.size = size;
        this.mimeType = mimeType;
        this.filename = filename;
        this.extra = new LinkedHashMap<>(extra);
    }

    @JsonCreator
    static FileMetadata fromJson(@JsonProperty(SIZE) Long size,
                                 @JsonProperty(MIME_TYPE) String mimeType,
                                 @JsonProperty(FILENAME) String filename) {
        return new FileMetadata(size, mimeType, filename, Map.of());
    }

    public static FileMetadata empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder().size(size).mimeType(mimeType).filename(filename);
        b.extra.putAll(extra);
        return b;
    }

    @JsonProperty(SIZE)
    public Long size() { return size; }

    @JsonProperty(MIME_TYPE)
    public String mimeType() { return mimeType; }

    @JsonProperty(FILENAME)
    public String filename() { return filename; }

    @JsonAnyGetter
    public Map<String, Object> extra() {
        return Collections.unmodifiableMap(extra);
    }

    // only called by Jackson while reading a persisted reference
    @JsonAnySetter
    private void readExtra(String key, Object value) {
        extra.put(key, scalar(key, value));
    }

    // integral numbers are kept as Long and fractional ones as Double, the types JSON reads back as
    private static Object scalar(String key, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) return value;
        if (value instanceof Long || value instanceof Double) return value;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < Long.SIZE ? (Object) big.longValue() : big;
        }
        throw new IllegalArgumentException("metadata '" + key + "' must be a scalar, got " + value.getClass().getName());
    }

    /**
     * Shorthand for any metadata value, well-known or extra.
     */
    @JsonIgnore
    public Optional<Object> get(String key) {
        switch (key) {
            case SIZE: return Optional.ofNullable(size);
            case MIME_TYPE: return Optional.ofNullable(mimeType);
            case FILENAME: return Optional.ofNullable(filename);
            default: return Optional.ofNullable(extra.get(key));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileMetadata)) return false;
        FileMetadata that = (FileMetadata) o;
        return Objects.equals(size, that.size)
                && Objects.equals(mimeType, that.mimeType)
                && Objects.equals(filename, that.filename)
                && Objects.equals(extra, that.extra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(size, mimeType, filename, extra);
    }

    @Override
    public String toString() {
        return "FileMetadata{" +
                "size=" + size +
                ", mimeType='" + mimeType + '\'' +
                ", filename='" + filename + '\'' +
                ", extra=" + extra +
                '}';
    }

    public static final class Builder {
        private Long size;
        private String mimeType;
        private String filename;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        private Builder() { }

        public Builder size(Long size) { this.size = size; return this; }
        public Builder mimeType(String mimeType) { this.mimeType = mimeType; return this; }
        public Builder filename(String filename) { this.filename = filename; return this; }

        public Long size() { return size; }
        public String mimeType() { return mimeType; }
        public String filename() { return filename; }

        /**
         * Adds an analyzer field. Values must be scalars (string, number or boolean); numbers are
         * stored as {@code Long} or {@code Double}. The well-known keys are routed to their typed fields.
         */
        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key");
            switch (key) {
                case SIZE:
                    return size(value == null ? null : ((Number) value).longValue());
                case MIME_TYPE:
                    return mimeType((String) value);
                case FILENAME:
                    return filename((String) value);
                default:
                    extra.put(key, scalar(key, value));
                    return this;
            }
        }

        public Builder putAll(Map<String, ?> values) {
            values.forEach(this::put);
            return this;
        }

        public FileMetadata build() {
            return new FileMetadata(size, mimeType, filename, extra);
        }
    }
}
