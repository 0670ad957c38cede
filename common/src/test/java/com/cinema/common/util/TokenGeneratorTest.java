package com.cinema.common.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TokenGeneratorTest {

    @Test
    void generateBookingReference_EightUppercaseAlphanumerics() {
        String reference = TokenGenerator.generateBookingReference();

        assertEquals(8, reference.length());
        assertTrue(reference.matches("[A-Z0-9]{8}"));
    }

    @Test
    void generateBookingReference_Varies() {
        Set<String> references = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            references.add(TokenGenerator.generateBookingReference());
        }

        assertTrue(references.size() > 95);
    }
}
