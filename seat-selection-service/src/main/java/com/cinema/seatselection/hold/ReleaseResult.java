package com.cinema.seatselection.hold;

public enum ReleaseResult {
    RELEASED,
    NOT_HOLDER,
    NOT_HELD,
    BOOKING_IN_PROGRESS
}
