package com.cinema.common.dto;

import com.cinema.common.enums.SeatState;
import lombok.*;

import java.util.List;

/**
 * Point-in-time listing of every seat of a showtime.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatMapSnapshot {

    private Long showtimeId;

    private List<SeatStateDto> seats;

    public long countByStatus(SeatState state) {
        return seats == null ? 0 : seats.stream().filter(s -> s.getStatus() == state).count();
    }
}
