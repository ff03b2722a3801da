package ae.teletronics.attachments.application.util;

import ae.teletronics.attachments.ports.StreamSource;

import java.io.IOException;
import java.io.InputStream;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Hashing {
    public static final String SHA_256 = "SHA-256";
    private Hashing() {}

    public static String sha256Hex(StreamSource source) throws IOException {
        return hex(source, SHA_256);
    }

    /** Streams the source through {@code algorithm} and returns the lower-case hex digest. */
    public static String hex(StreamSource source, String algorithm) throws IOException {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported digest: " + algorithm, e);
        }
        try (InputStream in = new DigestInputStream(source.openStream(), md)) {
            byte[] buf = new byte[8192];
            while (in.read(buf) != -1) { /* drain */ }
        }
        return HexFormat.of().formatHex(md.digest());
    }
}
