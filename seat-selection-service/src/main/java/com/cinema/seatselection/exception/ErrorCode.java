package com.cinema.seatselection.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    AUTHENTICATION_FAILED(HttpStatus.UNAUTHORIZED, "AUTHENTICATION_FAILED", "Authentication is required"),
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Invalid request"),
    SEAT_CONFLICT(HttpStatus.CONFLICT, "SEAT_CONFLICT", "Seat is already taken"),
    NOT_HOLDER(HttpStatus.FORBIDDEN, "NOT_HOLDER", "Seat is not held by you"),
    PERSISTENCE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "PERSISTENCE_FAILURE", "Booking store is unavailable, please retry"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE", "Seat selection is shutting down"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred. Please try again later.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Whether a client may retry the same request unchanged.
     */
    public boolean isRetryable() {
        return this == PERSISTENCE_FAILURE || this == SERVICE_UNAVAILABLE;
    }
}
