package com.cinema.seatselection.service;

import com.cinema.common.dto.SeatLayoutDto;
import com.cinema.common.entity.SeatLayout;
import com.cinema.common.entity.Showtime;
import com.cinema.seatselection.exception.InvalidInputException;
import com.cinema.seatselection.exception.PersistenceFailureException;
import com.cinema.seatselection.repository.SeatLayoutRepository;
import com.cinema.seatselection.repository.ShowtimeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SeatInventoryService {

    private final ShowtimeRepository showtimeRepository;
    private final SeatLayoutRepository seatLayoutRepository;

    /**
     * Seat layout of a showtime. Layouts are not edited while a showtime is on
     * sale, so they are cached per showtime.
     */
    @Cacheable(value = "showtime-layouts", key = "#showtimeId")
    @Transactional(readOnly = true)
    public ShowtimeLayout getLayout(Long showtimeId) {
        log.debug("Loading seat layout for showtime: {}", showtimeId);

        try {
            Showtime showtime = showtimeRepository.findById(showtimeId)
                .orElseThrow(() -> new InvalidInputException("Showtime not found: " + showtimeId));

            List<SeatLayoutDto> seats = seatLayoutRepository.findActiveByCinemaRoomId(showtime.getCinemaRoomId())
                .stream()
                .map(this::convertToDto)
                .toList();

            return new ShowtimeLayout(showtime.getId(), showtime.getCinemaRoomId(), seats);

        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Could not load seat layout for showtime " + showtimeId, e);
        }
    }

    /**
     * Whether the showtime currently accepts seat selection. Read from the store on
     * every call since the status changes while the layout does not.
     */
    @Transactional(readOnly = true)
    public boolean isOpenForSelection(Long showtimeId) {
        try {
            return showtimeRepository.findById(showtimeId)
                .map(Showtime::isBookable)
                .orElseThrow(() -> new InvalidInputException("Showtime not found: " + showtimeId));

        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Could not load status of showtime " + showtimeId, e);
        }
    }

    private SeatLayoutDto convertToDto(SeatLayout seat) {
        return SeatLayoutDto.builder()
            .seatId(seat.getSeatId())
            .rowLabel(seat.getRowLabel())
            .columnNumber(seat.getColumnNumber())
            .seatType(seat.getSeatType())
            .build();
    }
}
