package com.cinema.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatsClearedNotice {

    private Long showtimeId;

    private int count;
}
