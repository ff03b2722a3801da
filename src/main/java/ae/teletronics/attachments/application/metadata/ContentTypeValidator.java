package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.application.exceptions.InvalidFileException;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.StreamSource;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Accept/reject lists of MIME types; patterns may use {@code *} ("image/*").
 * Uploads whose type is unknown pass, so pair it with a strict {@link MimeTypeSource} when that matters.
 */
public class ContentTypeValidator implements MetadataAnalyzer {

    private final List<String> accepted;
    private final List<String> rejected;

    public ContentTypeValidator(List<String> accepted, List<String> rejected) {
        this.accepted = accepted == null ? List.of() : List.copyOf(accepted);
        this.rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public static ContentTypeValidator accepting(String... patterns) {
        return new ContentTypeValidator(List.of(patterns), List.of());
    }

    @Override
    public void analyze(StreamSource source, UploadContext context, FileMetadata.Builder metadata) {
        String mimeType = metadata.mimeType();
        if (mimeType == null) return;
        if (!accepted.isEmpty() && accepted.stream().noneMatch(p -> matches(mimeType, p))) {
            throw new InvalidFileException("has invalid content type");
        }
        if (rejected.stream().anyMatch(p -> matches(mimeType, p))) {
            throw new InvalidFileException("has forbidden content type");
        }
    }

    static boolean matches(String actual, String pattern) {
        String a = actual.toLowerCase(Locale.ROOT);
        String p = pattern.trim().toLowerCase(Locale.ROOT);
        if (!p.contains("*")) {
            return a.equals(p);
        }
        StringBuilder regex = new StringBuilder();
        for (String part : p.split("\\*", -1)) {
            if (regex.length() > 0) regex.append(".*");
            regex.append(Pattern.quote(part));
        }
        return a.matches(regex.toString());
    }
}
