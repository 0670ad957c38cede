package com.cinema.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatConflictNotice {

    private String seatId;

    private String reason; // SEAT_ALREADY_HELD, SEAT_ALREADY_BOOKED

    private String message;
}
