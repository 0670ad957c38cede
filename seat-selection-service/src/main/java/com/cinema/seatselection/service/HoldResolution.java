package com.cinema.seatselection.service;

import com.cinema.seatselection.hold.SeatHold;
import lombok.Value;

@Value
public class HoldResolution {

    public enum Outcome {
        ACQUIRED,
        SEAT_ALREADY_HELD,
        SEAT_ALREADY_BOOKED,
        INVALID_SEAT
    }

    Outcome outcome;
    SeatHold hold;
    boolean renewed;

    public static HoldResolution acquired(SeatHold hold, boolean renewed) {
        return new HoldResolution(Outcome.ACQUIRED, hold, renewed);
    }

    public static HoldResolution rejected(Outcome outcome) {
        return new HoldResolution(outcome, null, false);
    }

    public boolean isAcquired() {
        return outcome == Outcome.ACQUIRED;
    }
}
