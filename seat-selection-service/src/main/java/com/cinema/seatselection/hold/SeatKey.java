package com.cinema.seatselection.hold;

import lombok.Value;

/**
 * Canonical seat identity. Built only from normalized identifiers.
 */
@Value
public class SeatKey {

    long showtimeId;
    String seatId;

    public static SeatKey of(long showtimeId, String seatId) {
        return new SeatKey(showtimeId, seatId);
    }

    @Override
    public String toString() {
        return showtimeId + "/" + seatId;
    }
}
