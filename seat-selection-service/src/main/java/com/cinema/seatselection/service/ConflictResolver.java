package com.cinema.seatselection.service;

import com.cinema.seatselection.exception.InvalidInputException;
import com.cinema.seatselection.exception.PersistenceFailureException;
import com.cinema.seatselection.hold.AcquireResult;
import com.cinema.seatselection.hold.HoldStatus;
import com.cinema.seatselection.hold.HoldStore;
import com.cinema.seatselection.hold.SeatHold;
import com.cinema.seatselection.hold.SeatKey;
import com.cinema.seatselection.repository.BookedSeatRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether a seat may be held.
 *
 * The in-memory hold table is consulted first. Only a seat that nobody holds here
 * is checked against the booking store, because bookings may have been written by
 * another instance or outside the real-time path. The check and the acquire are
 * not atomic across instances; the unique constraint on booked seats catches that
 * case at commit time.
 */
@Service
@Slf4j
public class ConflictResolver {

    private final HoldStore holdStore;
    private final SeatInventoryService seatInventoryService;
    private final BookedSeatRepository bookedSeatRepository;
    private final Duration holdTtl;

    public ConflictResolver(HoldStore holdStore,
                            SeatInventoryService seatInventoryService,
                            BookedSeatRepository bookedSeatRepository,
                            @Value("${seat-selection.hold.ttl-seconds:300}") long holdTtlSeconds) {
        this.holdStore = holdStore;
        this.seatInventoryService = seatInventoryService;
        this.bookedSeatRepository = bookedSeatRepository;
        this.holdTtl = Duration.ofSeconds(holdTtlSeconds);
    }

    public HoldResolution tryAcquire(SeatKey seat, Long userId, String connectionId) {
        Optional<SeatHold> current = holdStore.find(seat);

        if (current.isPresent()) {
            SeatHold hold = current.get();
            if (hold.getStatus() == HoldStatus.CONFIRMED) {
                return HoldResolution.rejected(HoldResolution.Outcome.SEAT_ALREADY_BOOKED);
            }
            if (!hold.isHeldBy(userId)) {
                return HoldResolution.rejected(HoldResolution.Outcome.SEAT_ALREADY_HELD);
            }
            // the caller's own hold; no need to ask the booking store again
            return acquire(seat, userId, connectionId);
        }

        ShowtimeLayout layout = seatInventoryService.getLayout(seat.getShowtimeId());
        if (!layout.containsSeat(seat.getSeatId())) {
            log.debug("Seat {} is not part of the layout", seat);
            return HoldResolution.rejected(HoldResolution.Outcome.INVALID_SEAT);
        }
        if (!seatInventoryService.isOpenForSelection(seat.getShowtimeId())) {
            throw new InvalidInputException("Showtime " + seat.getShowtimeId() + " is not open for seat selection");
        }

        if (isBooked(seat)) {
            return HoldResolution.rejected(HoldResolution.Outcome.SEAT_ALREADY_BOOKED);
        }

        return acquire(seat, userId, connectionId);
    }

    public Duration getHoldTtl() {
        return holdTtl;
    }

    private HoldResolution acquire(SeatKey seat, Long userId, String connectionId) {
        AcquireResult result = holdStore.acquire(seat, userId, connectionId, holdTtl);

        if (result.getOutcome() == AcquireResult.Outcome.ACQUIRED) {
            return HoldResolution.acquired(result.getHold(), result.isRenewed());
        }
        if (result.getOutcome() == AcquireResult.Outcome.ALREADY_CONFIRMED) {
            return HoldResolution.rejected(HoldResolution.Outcome.SEAT_ALREADY_BOOKED);
        }
        return HoldResolution.rejected(HoldResolution.Outcome.SEAT_ALREADY_HELD);
    }

    private boolean isBooked(SeatKey seat) {
        try {
            return bookedSeatRepository.isBooked(seat.getShowtimeId(), seat.getSeatId());
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Could not check bookings for seat " + seat, e);
        }
    }
}
