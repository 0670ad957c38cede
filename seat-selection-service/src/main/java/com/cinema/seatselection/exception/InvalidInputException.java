package com.cinema.seatselection.exception;

public class InvalidInputException extends SeatSelectionException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
