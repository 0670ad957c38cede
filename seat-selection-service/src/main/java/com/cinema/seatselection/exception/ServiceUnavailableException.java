package com.cinema.seatselection.exception;

public class ServiceUnavailableException extends SeatSelectionException {

    public ServiceUnavailableException(String message) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message);
    }
}
