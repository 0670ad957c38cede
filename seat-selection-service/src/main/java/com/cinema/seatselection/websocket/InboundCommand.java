package com.cinema.seatselection.websocket;

import java.util.Arrays;
import java.util.Optional;

/**
 * Inbound real-time messages and their wire names.
 */
public enum InboundCommand {
    JOIN_SHOWTIME("join-showtime"),
    SELECT_SEAT("select-seat"),
    DESELECT_SEAT("deselect-seat"),
    CLEAR_ALL_SEATS("clear-all-seats"),
    EXTEND_SEAT_HOLD("extend-seat-hold"),
    CONFIRM_BOOKING("confirm-booking"),
    GET_SEATS_STATE("get-seats-state"),
    GET_SEAT_STATISTICS("get-seat-statistics");

    private final String wireName;

    InboundCommand(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<InboundCommand> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(command -> command.wireName.equals(wireName))
            .findFirst();
    }
}
