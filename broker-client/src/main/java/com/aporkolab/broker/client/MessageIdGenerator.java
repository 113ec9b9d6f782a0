package com.aporkolab.broker.client;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates message ids of the form {@code <prefix>-<epochMillis>-<9 base-36 chars>}.
 */
public class MessageIdGenerator {

    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    static final int SUFFIX_LENGTH = 9;

    private final String prefix;
    private final Clock clock;

    public MessageIdGenerator(String prefix) {
        this(prefix, Clock.systemUTC());
    }

    public MessageIdGenerator(String prefix, Clock clock) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        this.prefix = prefix;
        this.clock = clock;
    }

    public String next() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder id = new StringBuilder(prefix.length() + 24)
                .append(prefix).append('-')
                .append(clock.millis()).append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return id.toString();
    }

    public String getPrefix() {
        return prefix;
    }
}
