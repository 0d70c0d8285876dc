package io.coveytown.server.core;

import io.coveytown.server.spi.IdGenerator;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

/**
 * {@link IdGenerator} producing NanoID-style random strings.
 *
 * <p>Town ids are 8 upper-case hex characters so they are easy to read out loud; passwords,
 * session tokens and player ids use the 64-character URL-safe alphabet.
 */
public final class NanoIdGenerator implements IdGenerator {

    static final String URL_ALPHABET = "useandom-26T198340PX75pxJACKVERYMINDBUSHWOLF_GQZbfghjklqvwyzrict";
    static final String FRIENDLY_ALPHABET = "1234567890ABCDEF";

    private static final int TOWN_ID_LENGTH = 8;
    private static final int PASSWORD_LENGTH = 24;
    private static final int DEFAULT_LENGTH = 21;

    private final Random random;

    public NanoIdGenerator() {
        this(new SecureRandom());
    }

    public NanoIdGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String townId() {
        return generate(FRIENDLY_ALPHABET, TOWN_ID_LENGTH);
    }

    @Override
    public String townUpdatePassword() {
        return generate(URL_ALPHABET, PASSWORD_LENGTH);
    }

    @Override
    public String sessionToken() {
        return generate(URL_ALPHABET, DEFAULT_LENGTH);
    }

    @Override
    public String playerId() {
        return generate(URL_ALPHABET, DEFAULT_LENGTH);
    }

    private String generate(String alphabet, int length) {
        char[] out = new char[length];
        for (int i = 0; i < length; i++) {
            out[i] = alphabet.charAt(random.nextInt(alphabet.length()));
        }
        return new String(out);
    }
}
