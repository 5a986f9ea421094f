package com.example.cronkeeper.util;

import java.security.SecureRandom;

/**
 * Random names for unnamed entries and shared control-plane tokens.
 */
public final class RandomStrings {

    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    private static final String ALPHANUMERIC = LOWER + "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomStrings() {
    }

    public static String entryName() {
        return "entry-" + random(LOWER, 8);
    }

    public static String token() {
        return random(ALPHANUMERIC, 32);
    }

    private static String random(String alphabet, int length) {
        var sb = new StringBuilder(length);
        for (var i = 0; i < length; i++) {
            sb.append(alphabet.charAt(RANDOM.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
