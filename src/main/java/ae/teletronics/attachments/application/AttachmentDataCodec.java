package ae.teletronics.attachments.application;

import ae.teletronics.attachments.domain.model.UploadedFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.util.StringUtils;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes the JSON kept in a record's attachment column:
 * {@code {"id":..,"storage_key":..,"metadata":{..}}} or {@code null} for a single file,
 * an array of those or {@code []} for a list.
 */
public class AttachmentDataCodec {

    private static final TypeReference<List<UploadedFile>> FILE_LIST = new TypeReference<>() { };

    private final ObjectMapper mapper;

    public AttachmentDataCodec() {
        this(new ObjectMapper());
    }

    public AttachmentDataCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String write(UploadedFile file) {
        return serialize(file);
    }

    public String writeList(List<UploadedFile> files) {
        return serialize(files == null ? List.of() : files);
    }

    /**
     * @return null for a null, blank or {@code "null"} column
     * @throws IllegalArgumentException for anything that isn't a file reference
     */
    public UploadedFile read(String data) {
        if (!StringUtils.hasText(data)) return null;
        try {
            return mapper.readValue(data, UploadedFile.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed attachment data: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return an empty list for a null, blank, {@code "null"} or {@code "[]"} column
     */
    public List<UploadedFile> readList(String data) {
        if (!StringUtils.hasText(data)) return List.of();
        try {
            List<UploadedFile> files = mapper.readValue(data, FILE_LIST);
            if (files == null) return List.of();
            List<UploadedFile> result = new ArrayList<>(files.size());
            for (UploadedFile file : files) {
                if (file != null) result.add(file);
            }
            return result;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed attachment data: " + e.getOriginalMessage(), e);
        }
    }

    private String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize attachment data", e);
        }
    }
}
