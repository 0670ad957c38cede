package com.cinema.seatselection.session;

import com.cinema.common.dto.SeatEventMessage;

import java.io.IOException;

/**
 * An authenticated real-time connection as seen by the coordinator.
 */
public interface SeatSession {

    /**
     * Connection identity, unique per connection.
     */
    String getId();

    Long getUserId();

    boolean isOpen();

    void send(SeatEventMessage message) throws IOException;
}
