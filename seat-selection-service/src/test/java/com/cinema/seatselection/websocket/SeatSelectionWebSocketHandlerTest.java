package com.cinema.seatselection.websocket;

import com.cinema.seatselection.exception.PersistenceFailureException;
import com.cinema.seatselection.exception.ServiceUnavailableException;
import com.cinema.seatselection.hold.SeatKey;
import com.cinema.seatselection.service.SeatMapService;
import com.cinema.seatselection.service.SeatSelectionCoordinator;
import com.cinema.seatselection.session.SeatEventBroadcaster;
import com.cinema.seatselection.session.SeatSession;
import com.cinema.seatselection.session.SessionRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeatSelectionWebSocketHandlerTest {

    @Mock private SeatSelectionCoordinator coordinator;
    @Mock private SeatMapService seatMapService;
    @Mock private WebSocketSession webSocketSession;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SeatSelectionWebSocketHandler handler;

    @BeforeEach
    void setUp() throws Exception {
        SeatEventBroadcaster broadcaster = new SeatEventBroadcaster(new SessionRegistry(), seatMapService);
        handler = new SeatSelectionWebSocketHandler(coordinator, broadcaster, objectMapper, 10000, 524288);

        Map<String, Object> attributes = new HashMap<>();
        attributes.put(BearerTokenHandshakeInterceptor.USER_ATTRIBUTE, new AuthenticatedUser(10L, null, "USER"));
        lenient().when(webSocketSession.getId()).thenReturn("ws-1");
        lenient().when(webSocketSession.isOpen()).thenReturn(true);
        lenient().when(webSocketSession.getAttributes()).thenReturn(attributes);
    }

    private void connect() throws Exception {
        handler.afterConnectionEstablished(webSocketSession);
    }

    private void receive(String json) {
        handler.handleTextMessage(webSocketSession, new TextMessage(json));
    }

    private JsonNode lastSent() throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(webSocketSession, atLeastOnce()).sendMessage(captor.capture());
        return objectMapper.readTree(captor.getValue().getPayload());
    }

    // ─── connection lifecycle ────────────────────────────────────────────

    @Test
    void afterConnectionEstablished_RegistersAuthenticatedUser() throws Exception {
        connect();

        ArgumentCaptor<SeatSession> session = ArgumentCaptor.forClass(SeatSession.class);
        verify(coordinator).connect(session.capture());
        assertEquals(10L, session.getValue().getUserId());
        assertEquals("ws-1", session.getValue().getId());
        assertEquals(1, handler.openSessionCount());
    }

    @Test
    void afterConnectionEstablished_NoUser_ClosesSession() throws Exception {
        when(webSocketSession.getAttributes()).thenReturn(new HashMap<>());

        connect();

        verify(webSocketSession).close(CloseStatus.POLICY_VIOLATION);
        verifyNoInteractions(coordinator);
    }

    @Test
    void afterConnectionEstablished_CoordinatorStopped_ErrorAndClose() throws Exception {
        doThrow(new ServiceUnavailableException("Seat selection is not accepting requests"))
            .when(coordinator).connect(any());

        connect();

        assertEquals("SERVICE_UNAVAILABLE", lastSent().path("data").path("code").asText());
        verify(webSocketSession).close(CloseStatus.SERVICE_RESTARTED);
        assertEquals(0, handler.openSessionCount());
    }

    @Test
    void afterConnectionClosed_DisconnectsFromCoordinator() throws Exception {
        connect();

        handler.afterConnectionClosed(webSocketSession, CloseStatus.NORMAL);

        verify(coordinator).disconnect(any(SeatSession.class));
        assertEquals(0, handler.openSessionCount());
    }

    // ─── dispatch ────────────────────────────────────────────────────────

    @Test
    void joinShowtime_AcceptsBareId() throws Exception {
        connect();

        receive("{\"event\":\"join-showtime\",\"data\":\"12\"}");

        verify(coordinator).joinShowtime(any(SeatSession.class), eq(12L));
    }

    @Test
    void joinShowtime_AcceptsObjectWithAlternateKey() throws Exception {
        connect();

        receive("{\"event\":\"join-showtime\",\"data\":{\"Showtime_ID\":12}}");

        verify(coordinator).joinShowtime(any(SeatSession.class), eq(12L));
    }

    @Test
    void selectSeat_NormalizesIdentifiers() throws Exception {
        connect();

        receive("{\"event\":\"select-seat\",\"data\":{\"showtimeId\":\"3\",\"seatId\":\" C7 \"}}");

        verify(coordinator).selectSeat(any(SeatSession.class), eq(SeatKey.of(3L, "C7")));
    }

    @Test
    void confirmBooking_PassesSeatsAndAmount() throws Exception {
        connect();

        receive("{\"event\":\"confirm-booking\",\"data\":{\"showtimeId\":3,\"seatIds\":[\"A1\",\"A2\"],\"totalAmount\":19.5}}");

        verify(coordinator).confirmBooking(any(SeatSession.class), eq(3L), eq(List.of("A1", "A2")),
            argThat(amount -> amount.compareTo(new BigDecimal("19.5")) == 0));
    }

    @Test
    void getSeatStatistics_NoPayloadNeeded() throws Exception {
        connect();

        receive("{\"event\":\"get-seat-statistics\"}");

        verify(coordinator).sendStatistics(any(SeatSession.class));
    }

    // ─── errors ──────────────────────────────────────────────────────────

    @Test
    void malformedSeatId_ErrorToSenderAndNoCoordinatorCall() throws Exception {
        connect();

        receive("{\"event\":\"select-seat\",\"data\":{\"showtimeId\":3,\"seatId\":\"undefined\"}}");

        JsonNode error = lastSent();
        assertEquals("error", error.path("event").asText());
        assertEquals("INVALID_INPUT", error.path("data").path("code").asText());
        verify(coordinator, never()).selectSeat(any(), any());
    }

    @Test
    void unknownEvent_InvalidInput() throws Exception {
        connect();

        receive("{\"event\":\"launch-rockets\",\"data\":{}}");

        assertEquals("INVALID_INPUT", lastSent().path("data").path("code").asText());
    }

    @Test
    void malformedJson_InvalidInput() throws Exception {
        connect();

        receive("{not json");

        assertEquals("INVALID_INPUT", lastSent().path("data").path("code").asText());
    }

    @Test
    void coordinatorFailure_ReportedWithItsCode() throws Exception {
        connect();
        doThrow(new PersistenceFailureException("Could not check bookings", null))
            .when(coordinator).selectSeat(any(), any());

        receive("{\"event\":\"select-seat\",\"data\":{\"showtimeId\":3,\"seatId\":\"A1\"}}");

        JsonNode error = lastSent();
        assertEquals("PERSISTENCE_FAILURE", error.path("data").path("code").asText());
        assertEquals("Could not check bookings", error.path("data").path("message").asText());
    }

    @Test
    void unexpectedFailure_ReportedAsInternalError() throws Exception {
        connect();
        doThrow(new IllegalStateException("bug")).when(coordinator).sendSeatsState(any(), anyLong());

        receive("{\"event\":\"get-seats-state\",\"data\":{\"showtimeId\":3}}");

        JsonNode error = lastSent();
        assertEquals("INTERNAL_ERROR", error.path("data").path("code").asText());
        assertFalse(error.path("data").path("message").asText().contains("bug"));
    }
}
