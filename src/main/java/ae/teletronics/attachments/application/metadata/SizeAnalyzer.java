package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.application.util.CountingInputStream;
import ae.teletronics.attachments.application.util.TempFileSpool;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.StreamSource;

import java.io.IOException;

/** Byte length of the upload. */
public class SizeAnalyzer implements MetadataAnalyzer {

    @Override
    public void analyze(StreamSource source, UploadContext context, FileMetadata.Builder metadata) throws IOException {
        if (source instanceof TempFileSpool spool) {
            metadata.size(spool.size());
            return;
        }
        try (CountingInputStream in = new CountingInputStream(source.openStream())) {
            metadata.size(in.drain());
        }
    }
}
