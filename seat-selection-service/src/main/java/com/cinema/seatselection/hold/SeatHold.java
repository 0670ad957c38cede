package com.cinema.seatselection.hold;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class SeatHold {

    SeatKey seat;
    Long userId;
    String connectionId;
    Instant acquiredAt;
    Instant expiresAt;
    HoldStatus status;
    Instant confirmedAt;

    public boolean isExpiredAt(Instant now) {
        return status == HoldStatus.HELD && !now.isBefore(expiresAt);
    }

    /**
     * Whether the hold still blocks other users at {@code now}.
     */
    public boolean isLiveAt(Instant now) {
        return status != HoldStatus.HELD || now.isBefore(expiresAt);
    }

    public boolean isHeldBy(Long candidate) {
        return userId != null && userId.equals(candidate);
    }

    public long getShowtimeId() {
        return seat.getShowtimeId();
    }

    public String getSeatId() {
        return seat.getSeatId();
    }
}
