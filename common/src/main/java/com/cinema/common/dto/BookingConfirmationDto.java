package com.cinema.common.dto;

import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingConfirmationDto {

    private Long bookingId;

    private String bookingReference;

    private List<String> seatIds;

    private String message;
}
