package com.cinema.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatStatisticsDto {

    private int heldSeats;

    private int confirmingSeats;

    private int confirmedSeats;

    private int showtimesWithHolds;

    private int usersWithHolds;

    private int connectedSessions;

    private int pendingReleases;

    private long holdTtlSeconds;
}
