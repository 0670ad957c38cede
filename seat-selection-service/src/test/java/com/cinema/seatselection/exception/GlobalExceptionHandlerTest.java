package com.cinema.seatselection.exception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        request = new MockHttpServletRequest("POST", "/api/seat-selection/release-user-seats");
    }

    @Test
    void handleSeatSelectionException_InvalidInput() {
        ResponseEntity<ErrorResponse> response =
            handler.handleSeatSelectionException(new InvalidInputException("Showtime not found: 9"), request);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("INVALID_INPUT", response.getBody().getCode());
        assertEquals("/api/seat-selection/release-user-seats", response.getBody().getPath());
    }

    @Test
    void handleSeatSelectionException_Conflict() {
        ResponseEntity<ErrorResponse> response =
            handler.handleSeatSelectionException(new SeatConflictException("Seats already booked: [A1]"), request);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals(409, response.getBody().getStatus());
    }

    @Test
    void handleSeatSelectionException_PersistenceFailure() {
        ResponseEntity<ErrorResponse> response = handler.handleSeatSelectionException(
            new PersistenceFailureException("Could not load booked seats", new RuntimeException("db")), request);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("PERSISTENCE_FAILURE", response.getBody().getCode());
    }

    @Test
    void handleSeatSelectionException_NotHolder() {
        ResponseEntity<ErrorResponse> response =
            handler.handleSeatSelectionException(new NotHolderException("Seat A1 is held by another user"), request);

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
    }

    @Test
    void handleValidationException() {
        MethodArgumentNotValidException ex = mock(MethodArgumentNotValidException.class);
        BindingResult bindingResult = mock(BindingResult.class);
        when(ex.getBindingResult()).thenReturn(bindingResult);
        when(bindingResult.getFieldErrors()).thenReturn(List.of(
            new FieldError("request", "userId", "User ID is required")));

        ResponseEntity<ErrorResponse> response = handler.handleValidationException(ex, request);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("User ID is required", response.getBody().getValidationErrors().get("userId"));
    }

    @Test
    void handleGenericException_HidesDetails() {
        ResponseEntity<ErrorResponse> response = handler.handleGenericException(new IllegalStateException("secret"), request);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", response.getBody().getCode());
        assertFalse(response.getBody().getMessage().contains("secret"));
    }
}
