package com.cinema.seatselection.service;

import com.cinema.seatselection.hold.HoldStore;
import com.cinema.seatselection.hold.SeatHold;
import com.cinema.seatselection.session.SeatEventBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Reclaims holds whose holder went silent. Started and stopped by the
 * coordinator; every pass re-validates expiry per seat inside the hold table and
 * then compacts it.
 */
@Component
@Slf4j
public class HoldExpirationSweeper {

    private final HoldStore holdStore;
    private final SeatEventBroadcaster broadcaster;
    private final HoldLifecycleNotifier notifier;
    private final TaskScheduler taskScheduler;
    private final Duration interval;
    private final Duration confirmedRetention;

    private ScheduledFuture<?> sweepTask;

    public HoldExpirationSweeper(HoldStore holdStore,
                                 SeatEventBroadcaster broadcaster,
                                 HoldLifecycleNotifier notifier,
                                 @Qualifier("seatSelectionTaskScheduler") TaskScheduler taskScheduler,
                                 @Value("${seat-selection.sweeper.interval-ms:2000}") long intervalMs,
                                 @Value("${seat-selection.hold.confirmed-retention-seconds:60}") long confirmedRetentionSeconds) {
        this.holdStore = holdStore;
        this.broadcaster = broadcaster;
        this.notifier = notifier;
        this.taskScheduler = taskScheduler;
        this.interval = Duration.ofMillis(intervalMs);
        this.confirmedRetention = Duration.ofSeconds(confirmedRetentionSeconds);
    }

    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        sweepTask = taskScheduler.scheduleWithFixedDelay(this::sweepQuietly, interval);
        log.info("Hold expiration sweeper started, interval: {} ms", interval.toMillis());
    }

    public synchronized void stop() {
        if (sweepTask == null) {
            return;
        }
        sweepTask.cancel(false);
        sweepTask = null;
        log.info("Hold expiration sweeper stopped");
    }

    public synchronized boolean isRunning() {
        return sweepTask != null;
    }

    /**
     * Runs one pass and returns the number of reclaimed holds.
     */
    public int sweep() {
        Map<Long, List<SeatHold>> expired = holdStore.expireHolds();

        int reclaimed = 0;
        for (Map.Entry<Long, List<SeatHold>> entry : expired.entrySet()) {
            Long showtimeId = entry.getKey();
            reclaimed += entry.getValue().size();
            try {
                notifier.expired(showtimeId, entry.getValue());
                broadcaster.publishSnapshot(showtimeId);
            } catch (Exception e) {
                log.error("Failed to publish expired holds for showtime: {}", showtimeId, e);
            }
        }

        if (reclaimed > 0) {
            log.info("Expiration sweep: released {} holds in {} showtimes", reclaimed, expired.size());
        }

        holdStore.compact(confirmedRetention);
        return reclaimed;
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Expiration sweep failed", e);
        }
    }
}
