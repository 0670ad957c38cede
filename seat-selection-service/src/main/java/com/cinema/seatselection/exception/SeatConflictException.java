package com.cinema.seatselection.exception;

public class SeatConflictException extends SeatSelectionException {

    public SeatConflictException(String message) {
        super(ErrorCode.SEAT_CONFLICT, message);
    }
}
