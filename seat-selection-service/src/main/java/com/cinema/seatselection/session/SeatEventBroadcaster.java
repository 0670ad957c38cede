package com.cinema.seatselection.session;

import com.cinema.common.dto.SeatEventMessage;
import com.cinema.common.dto.SeatMapSnapshot;
import com.cinema.seatselection.exception.PersistenceFailureException;
import com.cinema.seatselection.service.SeatMapService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Fans events out to showtime groups.
 *
 * Snapshots are computed and sent while holding the lock of the showtime's stripe,
 * so members receive them in the order they were computed and the last one always
 * reflects the newest state. The stripes are fixed, so the lock set does not grow
 * with the number of showtimes. A session that fails to receive an event is skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SeatEventBroadcaster {

    private final SessionRegistry sessionRegistry;
    private final SeatMapService seatMapService;

    private static final int LOCK_STRIPES = 64;

    private final Object[] showtimeLocks = newLocks();

    public boolean sendTo(SeatSession session, SeatEventType type, Object data) {
        return deliver(session, new SeatEventMessage(type.getWireName(), data));
    }

    /**
     * Delivers an event to every open member of a showtime group.
     *
     * @return number of sessions the event was handed to
     */
    public int broadcast(long showtimeId, SeatEventType type, Object data) {
        SeatEventMessage message = new SeatEventMessage(type.getWireName(), data);
        List<SeatSession> members = sessionRegistry.sessionsIn(showtimeId);

        int delivered = 0;
        for (SeatSession session : members) {
            if (deliver(session, message)) {
                delivered++;
            }
        }
        log.debug("Broadcast {} to {}/{} sessions of showtime {}", type.getWireName(), delivered, members.size(), showtimeId);
        return delivered;
    }

    public void publishSnapshot(long showtimeId) {
        synchronized (lockFor(showtimeId)) {
            try {
                SeatMapSnapshot snapshot = seatMapService.snapshot(showtimeId);
                broadcast(showtimeId, SeatEventType.SEATS_STATE, snapshot);
            } catch (PersistenceFailureException e) {
                log.warn("Skipped seats-state broadcast for showtime {}: {}", showtimeId, e.getMessage());
            }
        }
    }

    /**
     * Broadcasts a single-seat change followed by a fresh snapshot.
     */
    public void publishSeatChange(long showtimeId, SeatEventType type, Object delta) {
        synchronized (lockFor(showtimeId)) {
            broadcast(showtimeId, type, delta);
            try {
                SeatMapSnapshot snapshot = seatMapService.snapshot(showtimeId);
                broadcast(showtimeId, SeatEventType.SEATS_STATE, snapshot);
            } catch (PersistenceFailureException e) {
                log.warn("Sent {} without seats-state for showtime {}: {}", type.getWireName(), showtimeId, e.getMessage());
            }
        }
    }

    private boolean deliver(SeatSession session, SeatEventMessage message) {
        if (!session.isOpen()) {
            log.debug("Skipping closed session {}", session.getId());
            return false;
        }
        try {
            session.send(message);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to deliver {} to session {}: {}", message.getEvent(), session.getId(), e.getMessage());
            return false;
        }
    }

    private Object lockFor(long showtimeId) {
        return showtimeLocks[Math.floorMod(Long.hashCode(showtimeId), LOCK_STRIPES)];
    }

    private static Object[] newLocks() {
        Object[] locks = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
        return locks;
    }
}
