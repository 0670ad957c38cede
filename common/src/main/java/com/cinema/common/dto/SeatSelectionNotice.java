package com.cinema.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatSelectionNotice {

    private Long showtimeId;

    private String seatId;

    private Long userId;

    private String status; // selected, deselected
}
