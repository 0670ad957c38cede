package com.cinema.seatselection.hold;

import lombok.Value;

import java.time.Instant;

@Value
public class ExtendResult {

    public enum Outcome {
        EXTENDED,
        LIMIT_REACHED,
        NOT_HOLDER,
        NOT_HELD
    }

    Outcome outcome;
    Instant newExpiry;

    public static ExtendResult extended(Instant newExpiry) {
        return new ExtendResult(Outcome.EXTENDED, newExpiry);
    }

    public static ExtendResult rejected(Outcome outcome, Instant currentExpiry) {
        return new ExtendResult(outcome, currentExpiry);
    }

    public boolean isExtended() {
        return outcome == Outcome.EXTENDED;
    }
}
