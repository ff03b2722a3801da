package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.StreamSource;

/**
 * Original filename from the caller, without any client-side directories
 * (some browsers send "C:\fakepath\photo.jpg").
 */
public class FilenameAnalyzer implements MetadataAnalyzer {

    @Override
    public void analyze(StreamSource source, UploadContext context, FileMetadata.Builder metadata) {
        metadata.filename(baseName(context.filename()));
    }

    static String baseName(String filename) {
        if (filename == null) return null;
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        return name.isEmpty() ? null : name;
    }
}
