package com.cinema.common.dto;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatHoldDto {

    private Long showtimeId;

    private String seatId;

    private Long userId;

    private Instant acquiredAt;

    private Instant expiresAt;

    private String status; // HELD, CONFIRMING, CONFIRMED

    private Long remainingSeconds;
}
