package com.cinema.common.dto;

import lombok.*;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatLayoutDto implements Serializable {

    private static final long serialVersionUID = 1L;

    private String seatId;

    private String rowLabel;

    private Integer columnNumber;

    private String seatType;
}
