package com.cinema.seatselection.service;

import com.cinema.common.dto.BookingDto;
import com.cinema.seatselection.hold.SeatHold;
import com.cinema.seatselection.hold.SeatKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Side channels of hold transitions: the Redis mirror and Kafka events.
 * Broadcasting to viewers stays with the caller.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HoldLifecycleNotifier {

    private final HoldMirror holdMirror;
    private final SeatEventPublisher eventPublisher;

    public void acquired(SeatHold hold) {
        holdMirror.record(hold);
        eventPublisher.publishSeatHeld(hold);
    }

    public void extended(SeatHold hold) {
        holdMirror.record(hold);
    }

    public void deselected(SeatKey seat, Long userId) {
        holdMirror.remove(List.of(seat));
        eventPublisher.publishSeatsReleased(seat.getShowtimeId(), userId, List.of(seat.getSeatId()),
            ReleaseReason.DESELECTED);
    }

    public void released(Collection<SeatHold> holds, ReleaseReason reason) {
        if (holds.isEmpty()) {
            return;
        }
        holdMirror.remove(keysOf(holds));
        groupByShowtimeAndUser(holds).forEach((showtimeId, byUser) ->
            byUser.forEach((userId, seatIds) ->
                eventPublisher.publishSeatsReleased(showtimeId, userId, seatIds, reason)));
    }

    public void expired(long showtimeId, List<SeatHold> holds) {
        if (holds.isEmpty()) {
            return;
        }
        holdMirror.remove(keysOf(holds));
        holds.stream()
            .collect(Collectors.groupingBy(SeatHold::getUserId,
                Collectors.mapping(SeatHold::getSeatId, Collectors.toList())))
            .forEach((userId, seatIds) -> eventPublisher.publishSeatsExpired(showtimeId, userId, seatIds));
    }

    public void booked(List<SeatHold> holds, BookingDto booking) {
        holdMirror.remove(keysOf(holds));
        eventPublisher.publishBookingConfirmed(booking);
        log.debug("Booking {} covers {} former holds", booking.getBookingReference(), holds.size());
    }

    private List<SeatKey> keysOf(Collection<SeatHold> holds) {
        return holds.stream().map(SeatHold::getSeat).toList();
    }

    private Map<Long, Map<Long, List<String>>> groupByShowtimeAndUser(Collection<SeatHold> holds) {
        return holds.stream()
            .collect(Collectors.groupingBy(SeatHold::getShowtimeId,
                Collectors.groupingBy(SeatHold::getUserId,
                    Collectors.mapping(SeatHold::getSeatId, Collectors.toList()))));
    }
}
