package com.cinema.seatselection.exception;

/**
 * The durable store could not be read or the booking commit failed. Hold state is
 * left untouched when this is thrown.
 */
public class PersistenceFailureException extends SeatSelectionException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, message, cause);
    }
}
