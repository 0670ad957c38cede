package com.cinema.seatselection.hold;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * In-process table of seat holds for every showtime being viewed.
 *
 * Every mutation of a seat runs inside {@link ConcurrentMap#compute} (or one of its
 * variants) on that seat's entry, so transitions on one seat are totally ordered
 * and each decision is re-validated against the entry as it is at that moment.
 * New entries are only inserted through a compute on the showtime's table, which
 * is what lets {@link #compact} drop empty tables safely. Nothing in here performs
 * I/O.
 */
@Slf4j
@Component
public class HoldStore {

    private final Clock clock;

    private final ConcurrentMap<Long, ConcurrentMap<String, SeatHold>> seatsByShowtime = new ConcurrentHashMap<>();

    // HELD + CONFIRMING entries; lets the sweeper skip an idle table
    private final AtomicInteger activeHolds = new AtomicInteger();

    public HoldStore(Clock clock) {
        this.clock = clock;
    }

    public AcquireResult acquire(SeatKey seat, Long userId, String connectionId, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Hold TTL must be positive: " + ttl);
        }

        AcquireResult[] result = new AcquireResult[1];
        computeSeat(seat.getShowtimeId(), seat.getSeatId(), (seatId, current) -> {
            Instant now = clock.instant();

            if (current == null || current.isExpiredAt(now)) {
                if (current == null) {
                    activeHolds.incrementAndGet();
                }
                SeatHold hold = SeatHold.builder()
                    .seat(seat)
                    .userId(userId)
                    .connectionId(connectionId)
                    .acquiredAt(now)
                    .expiresAt(now.plus(ttl))
                    .status(HoldStatus.HELD)
                    .build();
                result[0] = AcquireResult.acquired(hold, false);
                return hold;
            }

            if (current.getStatus() == HoldStatus.CONFIRMED) {
                result[0] = AcquireResult.alreadyConfirmed(current);
                return current;
            }

            if (!current.isHeldBy(userId)) {
                result[0] = AcquireResult.alreadyHeld(current);
                return current;
            }

            if (current.getStatus() == HoldStatus.CONFIRMING) {
                result[0] = AcquireResult.acquired(current, true);
                return current;
            }

            // Same user again: keep the deadline, follow the newest connection
            SeatHold renewed = current.toBuilder().connectionId(connectionId).build();
            result[0] = AcquireResult.acquired(renewed, true);
            return renewed;
        });

        log.debug("Acquire {} by user {}: {}", seat, userId, result[0].getOutcome());
        return result[0];
    }

    public ReleaseResult release(SeatKey seat, Long userId) {
        ConcurrentMap<String, SeatHold> seats = seatsByShowtime.get(seat.getShowtimeId());
        if (seats == null) {
            return ReleaseResult.NOT_HELD;
        }

        ReleaseResult[] result = {ReleaseResult.NOT_HELD};
        seats.computeIfPresent(seat.getSeatId(), (seatId, current) -> {
            if (current.getStatus() == HoldStatus.CONFIRMED || current.isExpiredAt(clock.instant())) {
                return current;
            }
            if (!current.isHeldBy(userId)) {
                result[0] = ReleaseResult.NOT_HOLDER;
                return current;
            }
            if (current.getStatus() == HoldStatus.CONFIRMING) {
                result[0] = ReleaseResult.BOOKING_IN_PROGRESS;
                return current;
            }
            result[0] = ReleaseResult.RELEASED;
            activeHolds.decrementAndGet();
            return null;
        });

        log.debug("Release {} by user {}: {}", seat, userId, result[0]);
        return result[0];
    }

    /**
     * Pushes the deadline of a live hold forward by {@code extension}, never beyond
     * {@code acquiredAt + maxHoldDuration}. A successful extension always moves the
     * deadline strictly later.
     */
    public ExtendResult extend(SeatKey seat, Long userId, Duration extension, Duration maxHoldDuration) {
        ConcurrentMap<String, SeatHold> seats = seatsByShowtime.get(seat.getShowtimeId());
        if (seats == null) {
            return ExtendResult.rejected(ExtendResult.Outcome.NOT_HELD, null);
        }

        ExtendResult[] result = {ExtendResult.rejected(ExtendResult.Outcome.NOT_HELD, null)};
        seats.computeIfPresent(seat.getSeatId(), (seatId, current) -> {
            if (current.getStatus() == HoldStatus.CONFIRMED || current.isExpiredAt(clock.instant())) {
                return current;
            }
            if (!current.isHeldBy(userId)) {
                result[0] = ExtendResult.rejected(ExtendResult.Outcome.NOT_HOLDER, null);
                return current;
            }
            if (current.getStatus() == HoldStatus.CONFIRMING) {
                return current;
            }

            Instant cap = current.getAcquiredAt().plus(maxHoldDuration);
            Instant candidate = current.getExpiresAt().plus(extension);
            Instant newExpiry = candidate.isAfter(cap) ? cap : candidate;

            if (!newExpiry.isAfter(current.getExpiresAt())) {
                result[0] = ExtendResult.rejected(ExtendResult.Outcome.LIMIT_REACHED, current.getExpiresAt());
                return current;
            }
            result[0] = ExtendResult.extended(newExpiry);
            return current.toBuilder().expiresAt(newExpiry).build();
        });

        log.debug("Extend {} by user {}: {}", seat, userId, result[0].getOutcome());
        return result[0];
    }

    public List<SeatHold> releaseAll(Long userId) {
        return releaseWhere(seatsByShowtime.keySet(), hold -> hold.isHeldBy(userId));
    }

    public List<SeatHold> releaseAll(Long userId, long showtimeId) {
        return releaseWhere(List.of(showtimeId), hold -> hold.isHeldBy(userId));
    }

    /**
     * Releases the user's holds that are still bound to one connection. Holds the
     * user has since taken over from another connection are kept.
     */
    public List<SeatHold> releaseAllForConnection(Long userId, String connectionId) {
        return releaseWhere(seatsByShowtime.keySet(),
            hold -> hold.isHeldBy(userId) && connectionId.equals(hold.getConnectionId()));
    }

    /**
     * Moves every hold of the user in a showtime to a new connection.
     */
    public int rebind(Long userId, long showtimeId, String connectionId) {
        ConcurrentMap<String, SeatHold> seats = seatsByShowtime.get(showtimeId);
        if (seats == null) {
            return 0;
        }

        AtomicInteger rebound = new AtomicInteger();
        for (String seatId : seats.keySet()) {
            seats.computeIfPresent(seatId, (id, current) -> {
                if (current.getStatus() == HoldStatus.CONFIRMED || !current.isHeldBy(userId)
                        || connectionId.equals(current.getConnectionId())) {
                    return current;
                }
                rebound.incrementAndGet();
                return current.toBuilder().connectionId(connectionId).build();
            });
        }
        return rebound.get();
    }

    public Optional<SeatHold> find(SeatKey seat) {
        ConcurrentMap<String, SeatHold> seats = seatsByShowtime.get(seat.getShowtimeId());
        if (seats == null) {
            return Optional.empty();
        }
        SeatHold hold = seats.get(seat.getSeatId());
        if (hold == null || !hold.isLiveAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(hold);
    }

    /**
     * Point-in-time copy of the live entries of a showtime, one per seat.
     */
    public List<SeatHold> holdsFor(long showtimeId) {
        ConcurrentMap<String, SeatHold> seats = seatsByShowtime.get(showtimeId);
        if (seats == null || seats.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        return seats.values().stream()
            .filter(hold -> hold.isLiveAt(now))
            .toList();
    }

    public List<SeatHold> expiringWithin(long showtimeId, Duration window) {
        Instant now = clock.instant();
        Instant horizon = now.plus(window);
        return holdsFor(showtimeId).stream()
            .filter(hold -> hold.getStatus() == HoldStatus.HELD)
            .filter(hold -> hold.getExpiresAt().isBefore(horizon))
            .toList();
    }

    /**
     * Removes every HELD entry whose deadline has passed. Expiry is checked again
     * inside the per-seat compute, so an extension that lands first wins.
     */
    public Map<Long, List<SeatHold>> expireHolds() {
        if (activeHolds.get() == 0) {
            return Map.of();
        }

        Map<Long, List<SeatHold>> expired = new HashMap<>();
        seatsByShowtime.forEach((showtimeId, seats) -> {
            if (seats.isEmpty()) {
                return;
            }
            for (Map.Entry<String, SeatHold> entry : seats.entrySet()) {
                if (!entry.getValue().isExpiredAt(clock.instant())) {
                    continue;
                }
                seats.computeIfPresent(entry.getKey(), (seatId, current) -> {
                    if (!current.isExpiredAt(clock.instant())) {
                        return current;
                    }
                    expired.computeIfAbsent(showtimeId, id -> new ArrayList<>()).add(current);
                    activeHolds.decrementAndGet();
                    return null;
                });
            }
        });

        if (!expired.isEmpty()) {
            log.debug("Expired holds in {} showtimes", expired.size());
        }
        return expired;
    }

    // ─── Booking commit protocol ─────────────────────────────────────────

    /**
     * Pins every listed seat for a booking commit. Either all seats move from HELD
     * to CONFIRMING or none does; the first failing seat is reported.
     */
    public BookingLockResult lockForBooking(long showtimeId, List<String> seatIds, Long userId) {
        ConcurrentMap<String, SeatHold> seats = seatsByShowtime.get(showtimeId);
        if (seats == null) {
            return BookingLockResult.rejected(seatIds.get(0), BookingLockResult.Failure.NOT_HELD);
        }

        List<SeatHold> pinned = new ArrayList<>();
        for (String seatId : seatIds) {
            BookingLockResult.Failure[] failure = {BookingLockResult.Failure.NOT_HELD};
            SeatHold[] locked = new SeatHold[1];

            seats.computeIfPresent(seatId, (id, current) -> {
                if (current.getStatus() == HoldStatus.CONFIRMED) {
                    return current;
                }
                if (!current.isHeldBy(userId)) {
                    failure[0] = BookingLockResult.Failure.NOT_HOLDER;
                    return current;
                }
                if (current.getStatus() == HoldStatus.CONFIRMING) {
                    failure[0] = BookingLockResult.Failure.BOOKING_IN_PROGRESS;
                    return current;
                }
                if (current.isExpiredAt(clock.instant())) {
                    failure[0] = BookingLockResult.Failure.EXPIRED;
                    return current;
                }
                locked[0] = current.toBuilder().status(HoldStatus.CONFIRMING).build();
                return locked[0];
            });

            if (locked[0] == null) {
                abortBooking(showtimeId, pinned.stream().map(SeatHold::getSeatId).toList(), userId);
                log.debug("Booking lock rejected for user {} on {}/{}: {}", userId, showtimeId, seatId, failure[0]);
                return BookingLockResult.rejected(seatId, failure[0]);
            }
            pinned.add(locked[0]);
        }
        return BookingLockResult.locked(pinned);
    }

    public List<SeatHold> completeBooking(long showtimeId, Collection<String> seatIds, Long userId) {
        List<SeatHold> confirmed = new ArrayList<>();
        transitionPinned(showtimeId, seatIds, userId, current -> {
            SeatHold done = current.toBuilder()
                .status(HoldStatus.CONFIRMED)
                .confirmedAt(clock.instant())
                .build();
            confirmed.add(done);
            activeHolds.decrementAndGet();
            return done;
        });
        return confirmed;
    }

    /**
     * Returns pinned seats to HELD with their original deadline.
     */
    public int abortBooking(long showtimeId, Collection<String> seatIds, Long userId) {
        AtomicInteger restored = new AtomicInteger();
        transitionPinned(showtimeId, seatIds, userId, current -> {
            restored.incrementAndGet();
            return current.toBuilder().status(HoldStatus.HELD).build();
        });
        return restored.get();
    }

    /**
     * Drops CONFIRMED entries after the booking was cancelled elsewhere.
     */
    public int clearConfirmed(long showtimeId, Collection<String> seatIds) {
        ConcurrentMap<String, SeatHold> seats = seatsByShowtime.get(showtimeId);
        if (seats == null) {
            return 0;
        }
        AtomicInteger cleared = new AtomicInteger();
        for (String seatId : seatIds) {
            seats.computeIfPresent(seatId, (id, current) -> {
                if (current.getStatus() != HoldStatus.CONFIRMED) {
                    return current;
                }
                cleared.incrementAndGet();
                return null;
            });
        }
        return cleared.get();
    }

    /**
     * Re-inserts a hold recovered after a restart if its seat is free and it has
     * not expired yet.
     */
    public boolean restore(SeatHold hold) {
        if (hold.getStatus() != HoldStatus.HELD || hold.isExpiredAt(clock.instant())) {
            return false;
        }
        boolean[] inserted = {false};
        computeSeat(hold.getShowtimeId(), hold.getSeatId(), (seatId, current) -> {
            if (current != null && current.isLiveAt(clock.instant())) {
                return current;
            }
            if (current == null) {
                activeHolds.incrementAndGet();
            }
            inserted[0] = true;
            return hold;
        });
        return inserted[0];
    }

    /**
     * Drops CONFIRMED entries older than {@code confirmedRetention} and the tables
     * of showtimes left without entries. A dropped seat stays unavailable through
     * its booked seat row.
     *
     * @return number of CONFIRMED entries dropped
     */
    public int compact(Duration confirmedRetention) {
        Instant cutoff = clock.instant().minus(confirmedRetention);
        AtomicInteger dropped = new AtomicInteger();

        for (Map.Entry<Long, ConcurrentMap<String, SeatHold>> table : seatsByShowtime.entrySet()) {
            ConcurrentMap<String, SeatHold> seats = table.getValue();
            for (String seatId : seats.keySet()) {
                seats.computeIfPresent(seatId, (id, current) -> {
                    if (current.getStatus() != HoldStatus.CONFIRMED || current.getConfirmedAt().isAfter(cutoff)) {
                        return current;
                    }
                    dropped.incrementAndGet();
                    return null;
                });
            }
            seatsByShowtime.computeIfPresent(table.getKey(), (showtimeId, current) -> current.isEmpty() ? null : current);
        }

        if (dropped.get() > 0) {
            log.debug("Dropped {} settled confirmed entries, {} showtime tables left", dropped.get(), seatsByShowtime.size());
        }
        return dropped.get();
    }

    public HoldStatistics statistics() {
        Instant now = clock.instant();
        int held = 0;
        int confirming = 0;
        int confirmed = 0;
        int showtimes = 0;
        Set<Long> users = new HashSet<>();

        for (ConcurrentMap<String, SeatHold> seats : seatsByShowtime.values()) {
            boolean active = false;
            for (SeatHold hold : seats.values()) {
                if (!hold.isLiveAt(now)) {
                    continue;
                }
                if (hold.getStatus() == HoldStatus.HELD) {
                    held++;
                } else if (hold.getStatus() == HoldStatus.CONFIRMING) {
                    confirming++;
                } else {
                    confirmed++;
                }
                if (hold.getStatus() != HoldStatus.CONFIRMED) {
                    active = true;
                    users.add(hold.getUserId());
                }
            }
            if (active) {
                showtimes++;
            }
        }
        return new HoldStatistics(held, confirming, confirmed, showtimes, users.size());
    }

    public int activeHoldCount() {
        return activeHolds.get();
    }

    public int showtimeCount() {
        return seatsByShowtime.size();
    }

    private void computeSeat(long showtimeId, String seatId,
                             BiFunction<String, SeatHold, SeatHold> remapping) {
        seatsByShowtime.compute(showtimeId, (id, seats) -> {
            ConcurrentMap<String, SeatHold> table = seats != null ? seats : new ConcurrentHashMap<>();
            table.compute(seatId, remapping);
            return table.isEmpty() ? null : table;
        });
    }

    private List<SeatHold> releaseWhere(Collection<Long> showtimeIds, Predicate<SeatHold> filter) {
        List<SeatHold> released = new ArrayList<>();
        for (Long showtimeId : showtimeIds) {
            ConcurrentMap<String, SeatHold> seats = seatsByShowtime.get(showtimeId);
            if (seats == null) {
                continue;
            }
            for (Map.Entry<String, SeatHold> entry : seats.entrySet()) {
                if (!filter.test(entry.getValue())) {
                    continue;
                }
                seats.computeIfPresent(entry.getKey(), (seatId, current) -> {
                    if (current.getStatus() != HoldStatus.HELD || !filter.test(current)) {
                        return current;
                    }
                    released.add(current);
                    activeHolds.decrementAndGet();
                    return null;
                });
            }
        }
        return released;
    }

    private void transitionPinned(long showtimeId, Collection<String> seatIds, Long userId,
                                  UnaryOperator<SeatHold> transition) {
        ConcurrentMap<String, SeatHold> seats = seatsByShowtime.get(showtimeId);
        if (seats == null) {
            return;
        }
        for (String seatId : seatIds) {
            seats.computeIfPresent(seatId, (id, current) -> {
                if (current.getStatus() != HoldStatus.CONFIRMING || !current.isHeldBy(userId)) {
                    return current;
                }
                return transition.apply(current);
            });
        }
    }
}
