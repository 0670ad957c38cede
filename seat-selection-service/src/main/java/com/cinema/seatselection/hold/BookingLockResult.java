package com.cinema.seatselection.hold;

import lombok.Value;

import java.util.List;

/**
 * Outcome of pinning a set of holds for a booking commit. Either every seat was
 * moved to {@link HoldStatus#CONFIRMING} or none was.
 */
@Value
public class BookingLockResult {

    public enum Failure {
        NOT_HELD,
        NOT_HOLDER,
        EXPIRED,
        BOOKING_IN_PROGRESS
    }

    boolean locked;
    List<SeatHold> holds;
    String failedSeatId;
    Failure failure;

    public static BookingLockResult locked(List<SeatHold> holds) {
        return new BookingLockResult(true, List.copyOf(holds), null, null);
    }

    public static BookingLockResult rejected(String seatId, Failure failure) {
        return new BookingLockResult(false, List.of(), seatId, failure);
    }
}
