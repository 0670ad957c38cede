package com.cinema.seatselection.service;

import com.cinema.common.dto.BookingDto;
import com.cinema.common.entity.Booking;
import com.cinema.common.entity.Showtime;
import com.cinema.common.util.TokenGenerator;
import com.cinema.seatselection.exception.InvalidInputException;
import com.cinema.seatselection.exception.SeatConflictException;
import com.cinema.seatselection.repository.BookedSeatRepository;
import com.cinema.seatselection.repository.BookingRepository;
import com.cinema.seatselection.repository.ShowtimeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Writes a confirmed booking and its seats in one transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BookingWriter {

    private final ShowtimeRepository showtimeRepository;
    private final BookingRepository bookingRepository;
    private final BookedSeatRepository bookedSeatRepository;

    @Transactional
    public BookingDto persist(Long userId, Long showtimeId, List<String> seatIds, BigDecimal totalAmount) {
        Showtime showtime = showtimeRepository.findById(showtimeId)
            .orElseThrow(() -> new InvalidInputException("Showtime not found: " + showtimeId));
        if (!showtime.isBookable()) {
            throw new InvalidInputException("Showtime " + showtimeId + " is no longer open for booking");
        }

        List<String> alreadyBooked = bookedSeatRepository.findBookedSeatIdsIn(showtimeId, seatIds);
        if (!alreadyBooked.isEmpty()) {
            throw new SeatConflictException("Seats already booked: " + alreadyBooked);
        }

        Booking booking = Booking.builder()
            .bookingReference(TokenGenerator.generateBookingReference())
            .userId(userId)
            .showtime(showtime)
            .totalAmount(totalAmount)
            .build();
        booking.confirm();
        seatIds.forEach(booking::addSeat);

        // flush so a unique violation on booked seats surfaces here, inside the caller's try
        booking = bookingRepository.saveAndFlush(booking);

        log.info("Booking {} persisted for user {} showtime {} seats {}",
                booking.getBookingReference(), userId, showtimeId, seatIds);

        return convertToDto(booking, showtimeId);
    }

    private BookingDto convertToDto(Booking booking, Long showtimeId) {
        return BookingDto.builder()
            .id(booking.getId())
            .bookingReference(booking.getBookingReference())
            .userId(booking.getUserId())
            .showtimeId(showtimeId)
            .seatIds(booking.getSeatIds())
            .totalAmount(booking.getTotalAmount())
            .status(booking.getStatus().name())
            .createdAt(booking.getCreatedAt())
            .confirmedAt(booking.getConfirmedAt())
            .build();
    }
}
