package ae.teletronics.attachments.application.util;

import java.security.SecureRandom;

public final class TokenGenerator {
    public static final int DEFAULT_LENGTH = 32;
    // lower-case only: ids must not collide on case-insensitive filesystems
    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final SecureRandom RNG = new SecureRandom();
    private TokenGenerator() {}
    public static String randomToken() {
        return randomToken(DEFAULT_LENGTH);
    }
    public static String randomToken(int len) {
        if (len <= 0) throw new IllegalArgumentException("len must be positive");
        char[] c = new char[len];
        for (int i = 0; i < len; i++) c[i] = ALPHABET[RNG.nextInt(ALPHABET.length)];
        return new String(c);
    }
}
