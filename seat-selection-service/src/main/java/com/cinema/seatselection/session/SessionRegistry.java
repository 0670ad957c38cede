package com.cinema.seatselection.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks live sessions and the showtime group each one has joined. A session is a
 * member of at most one group.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final ConcurrentMap<String, SeatSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> showtimeBySession = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, Set<SeatSession>> membersByShowtime = new ConcurrentHashMap<>();

    public void register(SeatSession session) {
        sessions.put(session.getId(), session);
    }

    /**
     * Moves the session into a showtime group, leaving its previous group.
     *
     * @return the showtime the session left, or {@code null}
     */
    public Long join(SeatSession session, long showtimeId) {
        sessions.putIfAbsent(session.getId(), session);

        Long[] previous = new Long[1];
        showtimeBySession.compute(session.getId(), (id, current) -> {
            previous[0] = current;
            if (current != null && current != showtimeId) {
                removeMember(current, session);
            }
            membersByShowtime.compute(showtimeId, (key, members) -> {
                Set<SeatSession> group = members != null ? members : ConcurrentHashMap.newKeySet();
                group.add(session);
                return group;
            });
            return showtimeId;
        });

        log.debug("Session {} joined showtime {} (left {})", session.getId(), showtimeId, previous[0]);
        return previous[0];
    }

    /**
     * Removes the session from its group. Holds are not touched.
     */
    public Optional<Long> leave(SeatSession session) {
        Long[] left = new Long[1];
        showtimeBySession.computeIfPresent(session.getId(), (id, current) -> {
            removeMember(current, session);
            left[0] = current;
            return null;
        });
        return Optional.ofNullable(left[0]);
    }

    public Optional<Long> unregister(SeatSession session) {
        Optional<Long> left = leave(session);
        sessions.remove(session.getId(), session);
        return left;
    }

    public List<SeatSession> sessionsIn(long showtimeId) {
        Set<SeatSession> members = membersByShowtime.get(showtimeId);
        return members == null ? List.of() : List.copyOf(members);
    }

    public Optional<Long> showtimeOf(String sessionId) {
        return Optional.ofNullable(showtimeBySession.get(sessionId));
    }

    public int sessionCount() {
        return sessions.size();
    }

    public int groupCount() {
        return membersByShowtime.size();
    }

    private void removeMember(long showtimeId, SeatSession session) {
        membersByShowtime.computeIfPresent(showtimeId, (key, members) -> {
            members.remove(session);
            return members.isEmpty() ? null : members;
        });
    }
}
