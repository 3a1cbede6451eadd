package com.transferhub.booking.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * "TH" followed by six upper-case alphanumerics.
 */
@Component
public class BookingRefGenerator {

    static final String PREFIX = "TH";
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int LENGTH = 6;

    private final SecureRandom random = new SecureRandom();

    public String next() {
        StringBuilder ref = new StringBuilder(PREFIX);
        for (int i = 0; i < LENGTH; i++) {
            ref.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return ref.toString();
    }
}
