package ae.teletronics.attachments.ports;

import java.io.IOException;
import java.io.InputStream;

/**
 * Bytes of an upload or stored object that can be read more than once.
 * Every call returns a new stream positioned at the start; the caller closes it.
 */
@FunctionalInterface
public interface StreamSource {
    InputStream openStream() throws IOException;
}
