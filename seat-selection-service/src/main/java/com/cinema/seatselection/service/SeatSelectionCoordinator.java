package com.cinema.seatselection.service;

import com.cinema.common.dto.BookingConfirmationDto;
import com.cinema.common.dto.BookingDto;
import com.cinema.common.dto.HoldExtensionDto;
import com.cinema.common.dto.SeatConflictNotice;
import com.cinema.common.dto.SeatHoldDto;
import com.cinema.common.dto.SeatMapSnapshot;
import com.cinema.common.dto.SeatSelectionNotice;
import com.cinema.common.dto.SeatStatisticsDto;
import com.cinema.common.dto.SeatsClearedNotice;
import com.cinema.seatselection.exception.InvalidInputException;
import com.cinema.seatselection.exception.NotHolderException;
import com.cinema.seatselection.exception.ServiceUnavailableException;
import com.cinema.seatselection.hold.ExtendResult;
import com.cinema.seatselection.hold.HoldStatistics;
import com.cinema.seatselection.hold.HoldStore;
import com.cinema.seatselection.hold.ReleaseResult;
import com.cinema.seatselection.hold.SeatHold;
import com.cinema.seatselection.hold.SeatKey;
import com.cinema.seatselection.session.DisconnectReconciler;
import com.cinema.seatselection.session.SeatEventBroadcaster;
import com.cinema.seatselection.session.SeatEventType;
import com.cinema.seatselection.session.SeatSession;
import com.cinema.seatselection.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for every seat selection operation, real-time or REST.
 *
 * Runs as a lifecycle bean: {@link #start()} rebuilds holds from the mirror and
 * starts the expiration sweeper, {@link #stop()} stops the sweeper, drops pending
 * disconnect releases and makes every further operation fail with
 * {@link ServiceUnavailableException}.
 */
@Service
@Slf4j
public class SeatSelectionCoordinator implements SmartLifecycle {

    private final HoldStore holdStore;
    private final ConflictResolver conflictResolver;
    private final SeatMapService seatMapService;
    private final BookingFinalizer bookingFinalizer;
    private final SessionRegistry sessionRegistry;
    private final SeatEventBroadcaster broadcaster;
    private final DisconnectReconciler disconnectReconciler;
    private final HoldExpirationSweeper expirationSweeper;
    private final HoldLifecycleNotifier notifier;
    private final HoldMirror holdMirror;
    private final Clock clock;
    private final Duration holdExtension;
    private final Duration maxHoldDuration;

    private volatile boolean running;

    public SeatSelectionCoordinator(HoldStore holdStore,
                                    ConflictResolver conflictResolver,
                                    SeatMapService seatMapService,
                                    BookingFinalizer bookingFinalizer,
                                    SessionRegistry sessionRegistry,
                                    SeatEventBroadcaster broadcaster,
                                    DisconnectReconciler disconnectReconciler,
                                    HoldExpirationSweeper expirationSweeper,
                                    HoldLifecycleNotifier notifier,
                                    HoldMirror holdMirror,
                                    Clock clock,
                                    @Value("${seat-selection.hold.extension-seconds:300}") long holdExtensionSeconds,
                                    @Value("${seat-selection.hold.max-duration-seconds:1200}") long maxHoldDurationSeconds) {
        this.holdStore = holdStore;
        this.conflictResolver = conflictResolver;
        this.seatMapService = seatMapService;
        this.bookingFinalizer = bookingFinalizer;
        this.sessionRegistry = sessionRegistry;
        this.broadcaster = broadcaster;
        this.disconnectReconciler = disconnectReconciler;
        this.expirationSweeper = expirationSweeper;
        this.notifier = notifier;
        this.holdMirror = holdMirror;
        this.clock = clock;
        this.holdExtension = Duration.ofSeconds(holdExtensionSeconds);
        this.maxHoldDuration = Duration.ofSeconds(maxHoldDurationSeconds);
    }

    // ─── Lifecycle ───────────────────────────────────────────────────────

    @Override
    public void start() {
        int restored = 0;
        for (SeatHold hold : holdMirror.loadActiveHolds()) {
            if (holdStore.restore(hold)) {
                restored++;
            }
        }
        expirationSweeper.start();
        running = true;
        log.info("Seat selection coordinator started ({} holds restored)", restored);
    }

    @Override
    public void stop() {
        running = false;
        expirationSweeper.stop();
        disconnectReconciler.cancelAll();
        log.info("Seat selection coordinator stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ─── Connections ─────────────────────────────────────────────────────

    public void connect(SeatSession session) {
        requireRunning();
        sessionRegistry.register(session);
        log.info("User {} connected: {}", session.getUserId(), session.getId());
    }

    public void disconnect(SeatSession session) {
        Optional<Long> lastShowtime = sessionRegistry.unregister(session);
        if (!running) {
            return;
        }
        disconnectReconciler.scheduleRelease(session, lastShowtime.orElse(null));
        log.info("User {} disconnected: {}", session.getUserId(), session.getId());
    }

    // ─── Real-time operations ────────────────────────────────────────────

    public void joinShowtime(SeatSession session, long showtimeId) {
        requireRunning();
        sessionRegistry.join(session, showtimeId);
        disconnectReconciler.cancelPending(session.getUserId(), showtimeId);
        int rebound = holdStore.rebind(session.getUserId(), showtimeId, session.getId());
        if (rebound > 0) {
            log.info("User {} resumed {} hold(s) in showtime {} on {}", session.getUserId(), rebound, showtimeId, session.getId());
        }

        broadcaster.sendTo(session, SeatEventType.SEATS_STATE, seatMapService.snapshot(showtimeId));
    }

    public void selectSeat(SeatSession session, SeatKey seat) {
        requireRunning();
        HoldResolution resolution = conflictResolver.tryAcquire(seat, session.getUserId(), session.getId());

        switch (resolution.getOutcome()) {
            case ACQUIRED:
                if (!resolution.isRenewed()) {
                    notifier.acquired(resolution.getHold());
                }
                log.info("Seat {} selected by user {}", seat, session.getUserId());
                broadcaster.publishSeatChange(seat.getShowtimeId(), SeatEventType.SEAT_SELECTED,
                    selectionNotice(seat, session.getUserId(), "selected"));
                break;
            case SEAT_ALREADY_HELD:
                rejectConflict(session, seat, resolution.getOutcome(),
                    "Seat " + seat.getSeatId() + " is being selected by another user");
                break;
            case SEAT_ALREADY_BOOKED:
                rejectConflict(session, seat, resolution.getOutcome(),
                    "Seat " + seat.getSeatId() + " is already booked");
                break;
            default:
                throw new InvalidInputException(
                    "Seat " + seat.getSeatId() + " does not exist in showtime " + seat.getShowtimeId());
        }
    }

    public void deselectSeat(SeatSession session, SeatKey seat) {
        requireRunning();
        ReleaseResult result = holdStore.release(seat, session.getUserId());

        switch (result) {
            case RELEASED:
                notifier.deselected(seat, session.getUserId());
                log.info("Seat {} deselected by user {}", seat, session.getUserId());
                broadcaster.publishSeatChange(seat.getShowtimeId(), SeatEventType.SEAT_DESELECTED,
                    selectionNotice(seat, session.getUserId(), "deselected"));
                break;
            case NOT_HELD:
                broadcaster.sendTo(session, SeatEventType.SEATS_STATE, seatMapService.snapshot(seat.getShowtimeId()));
                break;
            case NOT_HOLDER:
                throw new NotHolderException("Seat " + seat.getSeatId() + " is held by another user");
            default:
                throw new InvalidInputException(
                    "Seat " + seat.getSeatId() + " is being booked and cannot be released");
        }
    }

    public void clearAllSeats(SeatSession session, long showtimeId) {
        requireRunning();
        List<SeatHold> released = holdStore.releaseAll(session.getUserId(), showtimeId);

        if (!released.isEmpty()) {
            notifier.released(released, ReleaseReason.CLEARED);
            log.info("User {} cleared {} seat(s) in showtime {}", session.getUserId(), released.size(), showtimeId);
            broadcaster.publishSnapshot(showtimeId);
        }
        broadcaster.sendTo(session, SeatEventType.SEATS_CLEARED,
            SeatsClearedNotice.builder().showtimeId(showtimeId).count(released.size()).build());
    }

    public void extendHold(SeatSession session, SeatKey seat) {
        requireRunning();
        ExtendResult result = holdStore.extend(seat, session.getUserId(), holdExtension, maxHoldDuration);

        switch (result.getOutcome()) {
            case EXTENDED:
                holdStore.find(seat).ifPresent(notifier::extended);
                log.debug("Hold {} extended to {}", seat, result.getNewExpiry());
                broadcaster.sendTo(session, SeatEventType.SEAT_HOLD_EXTENDED,
                    new HoldExtensionDto(seat.getSeatId(), result.getNewExpiry()));
                break;
            case LIMIT_REACHED:
                throw new InvalidInputException("Hold on seat " + seat.getSeatId() + " cannot be extended any further");
            case NOT_HOLDER:
                throw new NotHolderException("Seat " + seat.getSeatId() + " is held by another user");
            default:
                throw new NotHolderException("Seat " + seat.getSeatId() + " is not held by you");
        }
    }

    public BookingDto confirmBooking(SeatSession session, long showtimeId, List<String> seatIds, BigDecimal totalAmount) {
        requireRunning();
        BookingDto booking = bookingFinalizer.confirm(session.getUserId(), showtimeId, seatIds, totalAmount);

        broadcaster.publishSnapshot(showtimeId);
        broadcaster.sendTo(session, SeatEventType.BOOKING_CONFIRMED, BookingConfirmationDto.builder()
            .bookingId(booking.getId())
            .bookingReference(booking.getBookingReference())
            .seatIds(booking.getSeatIds())
            .message("Booking confirmed")
            .build());
        return booking;
    }

    public void sendSeatsState(SeatSession session, long showtimeId) {
        requireRunning();
        broadcaster.sendTo(session, SeatEventType.SEATS_STATE, seatMapService.snapshot(showtimeId));
    }

    public void sendStatistics(SeatSession session) {
        requireRunning();
        broadcaster.sendTo(session, SeatEventType.SEAT_STATISTICS, statistics());
    }

    // ─── Operational (REST) ──────────────────────────────────────────────

    public SeatMapSnapshot snapshot(long showtimeId) {
        requireRunning();
        return seatMapService.snapshot(showtimeId);
    }

    public SeatStatisticsDto statistics() {
        HoldStatistics holds = holdStore.statistics();
        return SeatStatisticsDto.builder()
            .heldSeats(holds.getHeldSeats())
            .confirmingSeats(holds.getConfirmingSeats())
            .confirmedSeats(holds.getConfirmedSeats())
            .showtimesWithHolds(holds.getShowtimesWithHolds())
            .usersWithHolds(holds.getUsersWithHolds())
            .connectedSessions(sessionRegistry.sessionCount())
            .pendingReleases(disconnectReconciler.pendingCount())
            .holdTtlSeconds(conflictResolver.getHoldTtl().getSeconds())
            .build();
    }

    /**
     * Releases every hold of a user, in one showtime or in all of them.
     *
     * @return number of released holds
     */
    public int releaseUserSeats(Long userId, Long showtimeId) {
        requireRunning();
        List<SeatHold> released = showtimeId != null
            ? holdStore.releaseAll(userId, showtimeId)
            : holdStore.releaseAll(userId);

        if (!released.isEmpty()) {
            notifier.released(released, ReleaseReason.ADMIN_RELEASE);
            released.stream()
                .map(SeatHold::getShowtimeId)
                .collect(Collectors.toSet())
                .forEach(broadcaster::publishSnapshot);
            log.info("Released {} seat(s) of user {}", released.size(), userId);
        }
        return released.size();
    }

    public int runCleanup() {
        requireRunning();
        return expirationSweeper.sweep();
    }

    public List<SeatHoldDto> expiringHolds(long showtimeId, long withinSeconds) {
        if (withinSeconds <= 0) {
            throw new InvalidInputException("withinSeconds must be positive");
        }
        Instant now = clock.instant();
        return holdStore.expiringWithin(showtimeId, Duration.ofSeconds(withinSeconds)).stream()
            .map(hold -> SeatHoldDto.builder()
                .showtimeId(hold.getShowtimeId())
                .seatId(hold.getSeatId())
                .userId(hold.getUserId())
                .acquiredAt(hold.getAcquiredAt())
                .expiresAt(hold.getExpiresAt())
                .status(hold.getStatus().name())
                .remainingSeconds(Math.max(0, Duration.between(now, hold.getExpiresAt()).getSeconds()))
                .build())
            .toList();
    }

    private void rejectConflict(SeatSession session, SeatKey seat, HoldResolution.Outcome reason, String message) {
        log.warn("Seat {} conflict for user {}: {}", seat, session.getUserId(), reason);
        broadcaster.sendTo(session, SeatEventType.SEAT_CONFLICT, SeatConflictNotice.builder()
            .seatId(seat.getSeatId())
            .reason(reason.name())
            .message(message)
            .build());
        broadcaster.sendTo(session, SeatEventType.SEATS_STATE, seatMapService.snapshot(seat.getShowtimeId()));
    }

    private SeatSelectionNotice selectionNotice(SeatKey seat, Long userId, String status) {
        return SeatSelectionNotice.builder()
            .showtimeId(seat.getShowtimeId())
            .seatId(seat.getSeatId())
            .userId(userId)
            .status(status)
            .build();
    }

    private void requireRunning() {
        if (!running) {
            throw new ServiceUnavailableException("Seat selection is not accepting requests");
        }
    }
}
