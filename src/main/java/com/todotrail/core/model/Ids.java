package com.todotrail.core.model;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates opaque ids of the form {@code prefix-epochMillis-random}.
 */
public final class Ids {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private Ids() {}

    public static String generate(String prefix, Instant now) {
        var random = ThreadLocalRandom.current();
        var suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return prefix + "-" + now.toEpochMilli() + "-" + suffix;
    }
}
