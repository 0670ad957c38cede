package com.cinema.seatselection.websocket;

import com.cinema.seatselection.exception.InvalidInputException;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns loosely typed identifiers from client payloads into canonical values.
 * Anything that does not normalize cleanly is rejected.
 */
public final class IdentifierNormalizer {

    private static final String[] SHOWTIME_ID_FIELDS = {"showtimeId", "id", "showtime_id", "Showtime_ID"};
    private static final Set<String> MALFORMED_SEAT_IDS = Set.of(
        "undefined", "undefinedundefined", "null", "nan", "[object object]");
    private static final Pattern NUMERIC = Pattern.compile("\\d{1,18}");
    private static final Pattern SEAT_ID = Pattern.compile("[A-Za-z0-9_-]{1,16}");

    private IdentifierNormalizer() {
    }

    /**
     * Accepts a positive number, a numeric string, or an object carrying one of
     * {@code showtimeId}, {@code id}, {@code showtime_id}, {@code Showtime_ID}.
     */
    public static long showtimeId(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new InvalidInputException("Showtime ID is required");
        }
        if (node.isObject()) {
            for (String field : SHOWTIME_ID_FIELDS) {
                if (node.hasNonNull(field)) {
                    return showtimeId(node.get(field));
                }
            }
            throw new InvalidInputException("Showtime ID is required");
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return positive(node.asLong());
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (NUMERIC.matcher(text).matches()) {
                return positive(Long.parseLong(text));
            }
        }
        throw new InvalidInputException("Invalid showtime ID: " + node);
    }

    public static String seatId(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new InvalidInputException("Seat ID is required");
        }
        if (!node.isTextual()) {
            throw new InvalidInputException("Seat ID must be a string: " + node);
        }
        String seatId = node.asText().trim();
        if (seatId.isEmpty() || MALFORMED_SEAT_IDS.contains(seatId.toLowerCase())) {
            throw new InvalidInputException("Invalid seat ID: '" + seatId + "'");
        }
        if (!SEAT_ID.matcher(seatId).matches()) {
            throw new InvalidInputException("Invalid seat ID: '" + seatId + "'");
        }
        return seatId;
    }

    public static List<String> seatIds(JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new InvalidInputException("Seat IDs must be a non-empty list");
        }
        List<String> seatIds = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            seatIds.add(seatId(element));
        }
        return seatIds;
    }

    public static BigDecimal amount(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new InvalidInputException("Total amount is required");
        }
        try {
            BigDecimal amount = node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText().trim());
            if (amount.signum() < 0) {
                throw new InvalidInputException("Total amount must be non-negative");
            }
            return amount;
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Invalid total amount: " + node);
        }
    }

    private static long positive(long id) {
        if (id <= 0) {
            throw new InvalidInputException("Showtime ID must be positive: " + id);
        }
        return id;
    }
}
