package com.cinema.common.util;

import java.security.SecureRandom;

public final class TokenGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int BOOKING_REFERENCE_LENGTH = 8;

    private TokenGenerator() {
    }

    /**
     * Generate a booking reference (user-friendly)
     */
    public static String generateBookingReference() {
        StringBuilder sb = new StringBuilder(BOOKING_REFERENCE_LENGTH);
        for (int i = 0; i < BOOKING_REFERENCE_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
