package com.cinema.seatselection.exception;

public class NotHolderException extends SeatSelectionException {

    public NotHolderException(String message) {
        super(ErrorCode.NOT_HOLDER, message);
    }
}
