package com.cinema.seatselection.hold;

import lombok.Value;

@Value
public class AcquireResult {

    public enum Outcome {
        ACQUIRED,
        ALREADY_HELD,
        ALREADY_CONFIRMED
    }

    Outcome outcome;
    SeatHold hold; // the caller's hold when acquired, otherwise the blocking hold
    boolean renewed;

    public static AcquireResult acquired(SeatHold hold, boolean renewed) {
        return new AcquireResult(Outcome.ACQUIRED, hold, renewed);
    }

    public static AcquireResult alreadyHeld(SeatHold blocking) {
        return new AcquireResult(Outcome.ALREADY_HELD, blocking, false);
    }

    public static AcquireResult alreadyConfirmed(SeatHold blocking) {
        return new AcquireResult(Outcome.ALREADY_CONFIRMED, blocking, false);
    }

    public boolean isAcquired() {
        return outcome == Outcome.ACQUIRED;
    }
}
