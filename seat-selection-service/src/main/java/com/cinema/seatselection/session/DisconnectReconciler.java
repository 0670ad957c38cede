package com.cinema.seatselection.session;

import com.cinema.seatselection.hold.HoldStore;
import com.cinema.seatselection.hold.SeatHold;
import com.cinema.seatselection.service.HoldLifecycleNotifier;
import com.cinema.seatselection.service.ReleaseReason;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Releases the holds of a closed connection after a grace period.
 *
 * Each pending release is keyed by connection id and can be cancelled when the
 * same user joins the same showtime again before it fires.
 */
@Component
@Slf4j
public class DisconnectReconciler {

    private final HoldStore holdStore;
    private final SeatEventBroadcaster broadcaster;
    private final HoldLifecycleNotifier notifier;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration gracePeriod;

    private final ConcurrentMap<String, PendingRelease> pendingByConnection = new ConcurrentHashMap<>();

    public DisconnectReconciler(HoldStore holdStore,
                                SeatEventBroadcaster broadcaster,
                                HoldLifecycleNotifier notifier,
                                @Qualifier("seatSelectionTaskScheduler") TaskScheduler taskScheduler,
                                Clock clock,
                                @Value("${seat-selection.disconnect.grace-period-ms:3000}") long gracePeriodMs) {
        this.holdStore = holdStore;
        this.broadcaster = broadcaster;
        this.notifier = notifier;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.gracePeriod = Duration.ofMillis(gracePeriodMs);
    }

    public void scheduleRelease(SeatSession session, Long lastShowtimeId) {
        PendingRelease pending = new PendingRelease(session.getId(), session.getUserId(), lastShowtimeId);

        // registered before scheduling so an early fire still finds it
        PendingRelease replaced = pendingByConnection.put(pending.getConnectionId(), pending);
        if (replaced != null) {
            replaced.cancel();
        }
        pending.future = taskScheduler.schedule(() -> fire(pending), clock.instant().plus(gracePeriod));

        log.debug("Scheduled release of connection {} (user {}) in {} ms",
                pending.getConnectionId(), pending.getUserId(), gracePeriod.toMillis());
    }

    /**
     * Cancels pending releases of the user whose connection had joined the given
     * showtime, or no showtime at all.
     *
     * @return number of cancelled releases
     */
    public int cancelPending(Long userId, long showtimeId) {
        int cancelled = 0;
        for (PendingRelease pending : pendingByConnection.values()) {
            if (!pending.getUserId().equals(userId)) {
                continue;
            }
            if (pending.getShowtimeId() != null && pending.getShowtimeId() != showtimeId) {
                continue;
            }
            if (pendingByConnection.remove(pending.getConnectionId(), pending)) {
                pending.cancel();
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("User {} rejoined showtime {}: cancelled {} pending release(s)", userId, showtimeId, cancelled);
        }
        return cancelled;
    }

    public void cancelAll() {
        pendingByConnection.values().forEach(PendingRelease::cancel);
        pendingByConnection.clear();
    }

    public int pendingCount() {
        return pendingByConnection.size();
    }

    void fire(PendingRelease pending) {
        if (!pendingByConnection.remove(pending.getConnectionId(), pending)) {
            return;
        }

        try {
            List<SeatHold> released = holdStore.releaseAllForConnection(pending.getUserId(), pending.getConnectionId());
            if (released.isEmpty()) {
                log.debug("No holds left for closed connection {}", pending.getConnectionId());
                return;
            }

            log.info("Released {} seat(s) of user {} after disconnect of connection {}",
                    released.size(), pending.getUserId(), pending.getConnectionId());

            notifier.released(released, ReleaseReason.DISCONNECTED);

            Map<Long, List<SeatHold>> byShowtime = released.stream()
                .collect(Collectors.groupingBy(SeatHold::getShowtimeId));
            byShowtime.keySet().forEach(broadcaster::publishSnapshot);

        } catch (RuntimeException e) {
            log.error("Failed to release holds of closed connection: {}", pending.getConnectionId(), e);
        }
    }

    @Getter
    static final class PendingRelease {

        private final String connectionId;
        private final Long userId;
        private final Long showtimeId;
        private volatile ScheduledFuture<?> future;

        PendingRelease(String connectionId, Long userId, Long showtimeId) {
            this.connectionId = connectionId;
            this.userId = userId;
            this.showtimeId = showtimeId;
        }

        void cancel() {
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
