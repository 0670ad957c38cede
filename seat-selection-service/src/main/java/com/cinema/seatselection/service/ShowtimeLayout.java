package com.cinema.seatselection.service;

import com.cinema.common.dto.SeatLayoutDto;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Active seats of the cinema room a showtime plays in, in seat map order. Holds
 * nothing that changes while a showtime is on sale.
 */
@Value
public class ShowtimeLayout {

    Long showtimeId;
    Long cinemaRoomId;
    List<SeatLayoutDto> seats;
    Set<String> seatIds;

    public ShowtimeLayout(Long showtimeId, Long cinemaRoomId, List<SeatLayoutDto> seats) {
        this.showtimeId = showtimeId;
        this.cinemaRoomId = cinemaRoomId;
        this.seats = List.copyOf(seats);
        this.seatIds = seats.stream().map(SeatLayoutDto::getSeatId).collect(Collectors.toUnmodifiableSet());
    }

    public boolean containsSeat(String seatId) {
        return seatIds.contains(seatId);
    }
}
