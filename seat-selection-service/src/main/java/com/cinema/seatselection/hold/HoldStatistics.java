package com.cinema.seatselection.hold;

import lombok.Value;

@Value
public class HoldStatistics {

    int heldSeats;
    int confirmingSeats;
    int confirmedSeats;
    int showtimesWithHolds;
    int usersWithHolds;
}
