package com.cinema.seatselection.websocket;

import com.cinema.seatselection.exception.InvalidInputException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    // ─── showtime ids ────────────────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {"42", "\"42\"", "\" 42 \"", "{\"showtimeId\":42}", "{\"id\":\"42\"}",
        "{\"showtime_id\":42}", "{\"Showtime_ID\":42}"})
    void showtimeId_AcceptedShapes_NormalizeToSameValue(String raw) throws Exception {
        assertEquals(42L, IdentifierNormalizer.showtimeId(json(raw)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-3", "\"abc\"", "\"\"", "null", "{}", "{\"name\":\"x\"}", "4.5", "[1]", "true"})
    void showtimeId_InvalidShapes_Rejected(String raw) throws Exception {
        JsonNode node = json(raw);
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.showtimeId(node));
    }

    @Test
    void showtimeId_Missing_Rejected() {
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.showtimeId(null));
    }

    // ─── seat ids ────────────────────────────────────────────────────────

    @Test
    void seatId_Trimmed() throws Exception {
        assertEquals("B12", IdentifierNormalizer.seatId(json("\"  B12 \"")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"\"", "\"   \"", "\"undefined\"", "\"undefinedundefined\"", "\"null\"", "\"NaN\"",
        "\"ABCDEFGHIJKLMNOPQ\"", "12", "null", "\"A 1\""})
    void seatId_MalformedValues_Rejected(String raw) throws Exception {
        JsonNode node = json(raw);
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.seatId(node));
    }

    @Test
    void seatId_SixteenCharacters_Accepted() throws Exception {
        assertEquals("ABCDEFGHIJKLMNOP", IdentifierNormalizer.seatId(json("\"ABCDEFGHIJKLMNOP\"")));
    }

    @Test
    void seatIds_EveryElementNormalized() throws Exception {
        assertEquals(List.of("A1", "A2"), IdentifierNormalizer.seatIds(json("[\" A1\", \"A2 \"]")));
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.seatIds(json("[]")));
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.seatIds(json("[\"A1\", \"undefined\"]")));
    }

    // ─── amounts ─────────────────────────────────────────────────────────

    @Test
    void amount_NumberOrNumericString() throws Exception {
        assertEquals(0, new BigDecimal("25.50").compareTo(IdentifierNormalizer.amount(json("25.50"))));
        assertEquals(0, new BigDecimal("10").compareTo(IdentifierNormalizer.amount(json("\"10\""))));
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.amount(json("-1")));
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.amount(json("\"ten\"")));
        assertThrows(InvalidInputException.class, () -> IdentifierNormalizer.amount(null));
    }
}
