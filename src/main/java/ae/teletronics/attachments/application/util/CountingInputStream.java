package ae.teletronics.attachments.application.util;

import ae.teletronics.attachments.application.exceptions.InvalidFileException;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * An InputStream wrapper that counts bytes read and throws {@link InvalidFileException} if the count
 * exceeds the configured maximum size.
 */
public class CountingInputStream extends FilterInputStream {

    private final long maxSize;
    private long count;

    public CountingInputStream(InputStream in) {
        this(in, Long.MAX_VALUE);
    }

    public CountingInputStream(InputStream in, long maxSize) {
        super(in);
        this.maxSize = maxSize;
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b != -1) {
            count++;
            checkLimit();
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = super.read(b, off, len);
        if (n > 0) {
            count += n;
            checkLimit();
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = super.skip(n);
        count += skipped;
        checkLimit();
        return skipped;
    }

    public long getCount() {
        return count;
    }

    /** Reads the rest of the stream, returning the total byte count. */
    public long drain() throws IOException {
        byte[] buf = new byte[8192];
        while (read(buf) != -1) { /* count */ }
        return count;
    }

    private void checkLimit() {
        if (count > maxSize) {
            throw new InvalidFileException("is too large (maximum is " + maxSize + " bytes)");
        }
    }
}
