package com.cinema.seatselection.websocket;

import com.cinema.common.dto.ErrorNotice;
import com.cinema.seatselection.exception.ErrorCode;
import com.cinema.seatselection.exception.InvalidInputException;
import com.cinema.seatselection.exception.SeatSelectionException;
import com.cinema.seatselection.hold.SeatKey;
import com.cinema.seatselection.service.SeatSelectionCoordinator;
import com.cinema.seatselection.session.SeatEventBroadcaster;
import com.cinema.seatselection.session.SeatEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Decodes inbound seat selection messages and dispatches them to the
 * {@link SeatSelectionCoordinator}. Every failure is reported to the sending
 * session only, as an {@code error} event.
 */
@Component
@Slf4j
public class SeatSelectionWebSocketHandler extends TextWebSocketHandler {

    private final SeatSelectionCoordinator coordinator;
    private final SeatEventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;

    private final ConcurrentMap<String, WebSocketSeatSession> seatSessions = new ConcurrentHashMap<>();

    public SeatSelectionWebSocketHandler(SeatSelectionCoordinator coordinator,
                                         SeatEventBroadcaster broadcaster,
                                         ObjectMapper objectMapper,
                                         @Value("${seat-selection.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                                         @Value("${seat-selection.websocket.send-buffer-size-limit:524288}") int sendBufferSizeLimit) {
        this.coordinator = coordinator;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        AuthenticatedUser user = (AuthenticatedUser) session.getAttributes().get(BearerTokenHandshakeInterceptor.USER_ATTRIBUTE);
        if (user == null) {
            log.warn("Closing unauthenticated WebSocket session {}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
        WebSocketSeatSession seatSession = new WebSocketSeatSession(concurrent, user.getUserId(), objectMapper);
        try {
            coordinator.connect(seatSession);
            seatSessions.put(session.getId(), seatSession);
        } catch (SeatSelectionException e) {
            reportError(seatSession, e.getErrorCode(), e.getMessage());
            session.close(CloseStatus.SERVICE_RESTARTED);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSeatSession seatSession = seatSessions.get(session.getId());
        if (seatSession == null) {
            log.warn("Dropping message from unregistered session {}", session.getId());
            return;
        }

        String event = null;
        try {
            JsonNode envelope = parse(message.getPayload());
            event = envelope.path("event").asText(null);
            InboundCommand command = InboundCommand.fromWireName(event)
                .orElseThrow(() -> new InvalidInputException("Unknown event: " + envelope.path("event")));
            dispatch(seatSession, command, envelope.path("data"));

        } catch (SeatSelectionException e) {
            log.warn("Rejected {} from user {}: {}", event, seatSession.getUserId(), e.getMessage());
            reportError(seatSession, e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Error handling {} from user {}", event, seatSession.getUserId(), e);
            reportError(seatSession, ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSeatSession seatSession = seatSessions.remove(session.getId());
        if (seatSession != null) {
            log.debug("Session {} closed with {}", session.getId(), status);
            coordinator.disconnect(seatSession);
        }
    }

    int openSessionCount() {
        return seatSessions.size();
    }

    private void dispatch(WebSocketSeatSession session, InboundCommand command, JsonNode data) {
        switch (command) {
            case JOIN_SHOWTIME:
                coordinator.joinShowtime(session, showtimeIdOf(data));
                break;
            case SELECT_SEAT:
                coordinator.selectSeat(session, seatOf(data));
                break;
            case DESELECT_SEAT:
                coordinator.deselectSeat(session, seatOf(data));
                break;
            case CLEAR_ALL_SEATS:
                coordinator.clearAllSeats(session, showtimeIdOf(data));
                break;
            case EXTEND_SEAT_HOLD:
                coordinator.extendHold(session, seatOf(data));
                break;
            case CONFIRM_BOOKING:
                coordinator.confirmBooking(session,
                    showtimeIdOf(data),
                    IdentifierNormalizer.seatIds(data.get("seatIds")),
                    IdentifierNormalizer.amount(data.get("totalAmount")));
                break;
            case GET_SEATS_STATE:
                coordinator.sendSeatsState(session, showtimeIdOf(data));
                break;
            case GET_SEAT_STATISTICS:
                coordinator.sendStatistics(session);
                break;
            default:
                throw new InvalidInputException("Unsupported event: " + command.getWireName());
        }
    }

    private long showtimeIdOf(JsonNode data) {
        // join-showtime may send the id itself instead of an object
        if (!data.isObject()) {
            return IdentifierNormalizer.showtimeId(data);
        }
        return IdentifierNormalizer.showtimeId(data.has("showtimeId") ? data.get("showtimeId") : data);
    }

    private SeatKey seatOf(JsonNode data) {
        return SeatKey.of(showtimeIdOf(data), IdentifierNormalizer.seatId(data.get("seatId")));
    }

    private JsonNode parse(String payload) {
        try {
            JsonNode envelope = objectMapper.readTree(payload);
            return envelope != null ? envelope : MissingNode.getInstance();
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed message: " + e.getOriginalMessage());
        }
    }

    private void reportError(WebSocketSeatSession session, ErrorCode errorCode, String message) {
        broadcaster.sendTo(session, SeatEventType.ERROR, ErrorNotice.builder()
            .message(message)
            .code(errorCode.getCode())
            .build());
    }
}
