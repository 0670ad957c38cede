package com.cinema.seatselection.exception;

/**
 * Base class for every rejected seat selection operation.
 */
public class SeatSelectionException extends RuntimeException {

    private final ErrorCode errorCode;

    public SeatSelectionException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public SeatSelectionException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SeatSelectionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
