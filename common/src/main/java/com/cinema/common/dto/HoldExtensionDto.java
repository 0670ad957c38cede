package com.cinema.common.dto;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HoldExtensionDto {

    private String seatId;

    private Instant newExpiry;
}
