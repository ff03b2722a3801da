package ae.teletronics.attachments.application.metadata;

import ae.teletronics.attachments.application.UploadContext;
import ae.teletronics.attachments.application.exceptions.InvalidFileException;
import ae.teletronics.attachments.domain.model.FileMetadata;
import ae.teletronics.attachments.ports.StreamSource;
import ae.teletronics.attachments.ports.VirusScanner;

import java.io.IOException;
import java.util.Objects;

/**
 * Runs the {@link VirusScanner} and refuses anything it doesn't report clean.
 */
public class VirusScanAnalyzer implements MetadataAnalyzer {

    private final VirusScanner scanner;

    public VirusScanAnalyzer(VirusScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    @Override
    public void analyze(StreamSource source, UploadContext context, FileMetadata.Builder metadata) throws IOException {
        VirusScanner.ScanReport report = scanner.scan(source);
        switch (report.verdict()) {
            case INFECTED -> throw new InvalidFileException("Upload rejected: " + report.details());
            case ERROR -> throw new InvalidFileException("Virus scan error: " + report.details());
            default -> { /* CLEAN */ }
        }
    }
}
