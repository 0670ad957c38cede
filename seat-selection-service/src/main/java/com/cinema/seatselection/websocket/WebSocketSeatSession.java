package com.cinema.seatselection.websocket;

import com.cinema.common.dto.SeatEventMessage;
import com.cinema.seatselection.session.SeatSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link SeatSession} over a Spring WebSocket session. The wrapped session must be
 * safe for concurrent sends, e.g. a {@code ConcurrentWebSocketSessionDecorator}.
 */
public class WebSocketSeatSession implements SeatSession {

    private final WebSocketSession delegate;
    private final Long userId;
    private final ObjectMapper objectMapper;

    public WebSocketSeatSession(WebSocketSession delegate, Long userId, ObjectMapper objectMapper) {
        this.delegate = delegate;
        this.userId = userId;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return delegate.getId();
    }

    @Override
    public Long getUserId() {
        return userId;
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public void send(SeatEventMessage message) throws IOException {
        delegate.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    }

    @Override
    public String toString() {
        return "WebSocketSeatSession[" + getId() + ", user=" + userId + "]";
    }
}
