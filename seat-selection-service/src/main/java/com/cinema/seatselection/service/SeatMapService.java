package com.cinema.seatselection.service;

import com.cinema.common.dto.SeatLayoutDto;
import com.cinema.common.dto.SeatMapSnapshot;
import com.cinema.common.dto.SeatStateDto;
import com.cinema.common.enums.SeatState;
import com.cinema.seatselection.exception.PersistenceFailureException;
import com.cinema.seatselection.hold.HoldStatus;
import com.cinema.seatselection.hold.HoldStore;
import com.cinema.seatselection.hold.SeatHold;
import com.cinema.seatselection.repository.BookedSeatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds seat map snapshots by merging the layout, booked seats and live holds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SeatMapService {

    private final SeatInventoryService seatInventoryService;
    private final BookedSeatRepository bookedSeatRepository;
    private final HoldStore holdStore;

    /**
     * Fails with {@link PersistenceFailureException} when booked seats cannot be
     * read; a partial map is never returned.
     */
    public SeatMapSnapshot snapshot(long showtimeId) {
        ShowtimeLayout layout = seatInventoryService.getLayout(showtimeId);

        Set<String> booked;
        try {
            booked = new HashSet<>(bookedSeatRepository.findBookedSeatIds(showtimeId));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Could not load booked seats for showtime " + showtimeId, e);
        }

        // read after the booking store so a commit in between shows up as CONFIRMED or HELD, never AVAILABLE
        Map<String, SeatHold> holds = holdStore.holdsFor(showtimeId).stream()
            .collect(Collectors.toMap(SeatHold::getSeatId, Function.identity()));

        List<SeatStateDto> seats = layout.getSeats().stream()
            .map(seat -> toSeatState(seat, booked.contains(seat.getSeatId()), holds.get(seat.getSeatId())))
            .toList();

        log.debug("Snapshot for showtime {}: {} seats, {} booked, {} in memory",
                showtimeId, seats.size(), booked.size(), holds.size());

        return SeatMapSnapshot.builder()
            .showtimeId(showtimeId)
            .seats(seats)
            .build();
    }

    private SeatStateDto toSeatState(SeatLayoutDto seat, boolean booked, SeatHold hold) {
        SeatStateDto.SeatStateDtoBuilder state = SeatStateDto.builder()
            .seatId(seat.getSeatId())
            .rowLabel(seat.getRowLabel())
            .columnNumber(seat.getColumnNumber())
            .seatType(seat.getSeatType());

        if (booked || (hold != null && hold.getStatus() == HoldStatus.CONFIRMED)) {
            return state.status(SeatState.CONFIRMED).build();
        }
        if (hold != null) {
            return state.status(SeatState.HELD)
                .userId(hold.getUserId())
                .expiresAt(hold.getExpiresAt())
                .build();
        }
        return state.status(SeatState.AVAILABLE).build();
    }
}
