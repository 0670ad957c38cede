package com.cinema.common.enums;

/**
 * Seat state as seen by viewers of a showtime's seat map.
 */
public enum SeatState {
    AVAILABLE,
    HELD,
    CONFIRMED
}
