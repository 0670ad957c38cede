package com.cinema.common.dto;

import com.cinema.common.enums.SeatState;
import lombok.*;

import java.io.Serializable;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatStateDto implements Serializable {

    private static final long serialVersionUID = 1L;

    private String seatId;

    private String rowLabel;

    private Integer columnNumber;

    private String seatType;

    private SeatState status;

    private Long userId; // holder, only while HELD

    private Instant expiresAt; // only while HELD

    public boolean isAvailable() {
        return status == SeatState.AVAILABLE;
    }
}
