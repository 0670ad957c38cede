package com.cinema.seatselection.session;

/**
 * Outbound real-time events and their wire names.
 */
public enum SeatEventType {
    SEATS_STATE("seats-state"),
    SEAT_SELECTED("seat-selected"),
    SEAT_DESELECTED("seat-deselected"),
    SEAT_CONFLICT("seat-conflict"),
    SEATS_CLEARED("seats-cleared"),
    SEAT_HOLD_EXTENDED("seat-hold-extended"),
    BOOKING_CONFIRMED("booking-confirmed"),
    SEAT_STATISTICS("seat-statistics"),
    ERROR("error");

    private final String wireName;

    SeatEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
