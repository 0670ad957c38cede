package com.cinema.seatselection.service;

import com.cinema.common.dto.BookingDto;
import com.cinema.seatselection.exception.InvalidInputException;
import com.cinema.seatselection.exception.NotHolderException;
import com.cinema.seatselection.exception.PersistenceFailureException;
import com.cinema.seatselection.exception.SeatConflictException;
import com.cinema.seatselection.hold.BookingLockResult;
import com.cinema.seatselection.hold.HoldStore;
import com.cinema.seatselection.hold.SeatHold;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;

/**
 * Turns a set of the caller's holds into a durable booking, all or nothing.
 *
 * The holds are pinned before the write so they cannot expire or be released
 * while the transaction runs. If the write fails they go back to HELD with their
 * original deadline and the caller may retry.
 */
@Service
@Slf4j
public class BookingFinalizer {

    private final HoldStore holdStore;
    private final BookingWriter bookingWriter;
    private final HoldLifecycleNotifier notifier;
    private final int maxSeatsPerBooking;

    public BookingFinalizer(HoldStore holdStore,
                            BookingWriter bookingWriter,
                            HoldLifecycleNotifier notifier,
                            @Value("${seat-selection.booking.max-seats:10}") int maxSeatsPerBooking) {
        this.holdStore = holdStore;
        this.bookingWriter = bookingWriter;
        this.notifier = notifier;
        this.maxSeatsPerBooking = maxSeatsPerBooking;
    }

    public BookingDto confirm(Long userId, long showtimeId, List<String> seatIds, BigDecimal totalAmount) {
        validateRequest(seatIds, totalAmount);

        BookingLockResult lock = holdStore.lockForBooking(showtimeId, seatIds, userId);
        if (!lock.isLocked()) {
            log.warn("Booking rejected for user {} showtime {}: seat {} {}",
                    userId, showtimeId, lock.getFailedSeatId(), lock.getFailure());
            throw new NotHolderException(rejectionMessage(lock));
        }

        BookingDto booking;
        try {
            booking = bookingWriter.persist(userId, showtimeId, seatIds, totalAmount);
        } catch (DataIntegrityViolationException e) {
            holdStore.abortBooking(showtimeId, seatIds, userId);
            log.warn("Booking conflict for user {} showtime {} seats {}", userId, showtimeId, seatIds);
            throw new SeatConflictException("One or more seats were booked by someone else");
        } catch (DataAccessException e) {
            holdStore.abortBooking(showtimeId, seatIds, userId);
            throw new PersistenceFailureException("Booking could not be saved, your seats are still held", e);
        } catch (RuntimeException e) {
            holdStore.abortBooking(showtimeId, seatIds, userId);
            throw e;
        }

        List<SeatHold> confirmed = holdStore.completeBooking(showtimeId, seatIds, userId);
        notifier.booked(confirmed, booking);

        log.info("Booking confirmed: {} for user {} showtime {} ({} seats)",
                booking.getBookingReference(), userId, showtimeId, seatIds.size());
        return booking;
    }

    private void validateRequest(List<String> seatIds, BigDecimal totalAmount) {
        if (seatIds == null || seatIds.isEmpty()) {
            throw new InvalidInputException("At least one seat is required");
        }
        if (seatIds.size() > maxSeatsPerBooking) {
            throw new InvalidInputException("At most " + maxSeatsPerBooking + " seats can be booked at once");
        }
        if (new HashSet<>(seatIds).size() != seatIds.size()) {
            throw new InvalidInputException("Duplicate seats in booking request");
        }
        if (totalAmount == null || totalAmount.signum() < 0) {
            throw new InvalidInputException("Total amount must be non-negative");
        }
    }

    private String rejectionMessage(BookingLockResult lock) {
        String seatId = lock.getFailedSeatId();
        switch (lock.getFailure()) {
            case NOT_HOLDER:
                return "Seat " + seatId + " is held by another user";
            case EXPIRED:
                return "Your hold on seat " + seatId + " has expired";
            case BOOKING_IN_PROGRESS:
                return "Seat " + seatId + " is already being booked";
            default:
                return "Seat " + seatId + " is not held by you";
        }
    }
}
