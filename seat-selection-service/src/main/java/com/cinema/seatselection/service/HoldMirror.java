package com.cinema.seatselection.service;

import com.cinema.seatselection.hold.SeatHold;
import com.cinema.seatselection.hold.SeatKey;

import java.util.Collection;
import java.util.List;

/**
 * Out-of-process copy of live holds, used to rebuild the hold table after a
 * restart. Writes are best effort and never fail the caller.
 */
public interface HoldMirror {

    void record(SeatHold hold);

    void remove(Collection<SeatKey> seats);

    List<SeatHold> loadActiveHolds();
}
