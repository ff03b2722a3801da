package ae.teletronics.attachments.application.util;

import ae.teletronics.attachments.ports.StreamSource;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Copies a one-shot upload stream into a temp file so it can be re-read from the start by every
 * analyzer and then by the storage write. Closing the spool deletes the temp file.
 */
public final class TempFileSpool implements StreamSource, Closeable {

    private final Path tempFile;
    private final long size;

    private TempFileSpool(Path tempFile, long size) {
        this.tempFile = tempFile;
        this.size = size;
    }

    public static TempFileSpool spool(InputStream data) throws IOException {
        return spool(data, Long.MAX_VALUE);
    }

    /**
     * @param maxSize bytes accepted before the upload is rejected as too large
     */
    public static TempFileSpool spool(InputStream data, long maxSize) throws IOException {
        Path tempFile = Files.createTempFile("attachment-spool-", ".tmp");
        tempFile.toFile().deleteOnExit();
        try (CountingInputStream counted = new CountingInputStream(data, maxSize);
             OutputStream out = Files.newOutputStream(tempFile, StandardOpenOption.TRUNCATE_EXISTING)) {
            counted.transferTo(out);
            return new TempFileSpool(tempFile, counted.getCount());
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    public Path path() {
        return tempFile;
    }

    public long size() {
        return size;
    }

    @Override
    public InputStream openStream() throws IOException {
        return Files.newInputStream(tempFile, StandardOpenOption.READ);
    }

    @Override
    public void close() throws IOException {
        Files.deleteIfExists(tempFile);
    }
}
