package com.cinema.seatselection.hold;

public enum HoldStatus {
    /** Held by a user until it expires, is released or is booked. */
    HELD,
    /** Pinned while the booking commit is running; cannot be released or expired. */
    CONFIRMING,
    /** Booked through this process. Terminal until an external cancellation. */
    CONFIRMED
}
