package in.chartbridge.infrastructure.tradingview.protocol;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Client-generated session identifiers: a prefix plus 12 random alphanumerics.
 */
public final class SessionIds {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int LENGTH = 12;

    public static String chartSession() {
        return generate("cs_");
    }

    static String generate(String prefix) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(prefix.length() + LENGTH).append(prefix);
        for (int i = 0; i < LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    private SessionIds() {}
}
