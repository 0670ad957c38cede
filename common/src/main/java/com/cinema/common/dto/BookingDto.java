package com.cinema.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingDto {

    private Long id;

    private String bookingReference;

    private Long userId;

    private Long showtimeId;

    private List<String> seatIds;

    private BigDecimal totalAmount;

    private String status; // CONFIRMED, CANCELLED

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime confirmedAt;

    public int getTicketCount() {
        return seatIds != null ? seatIds.size() : 0;
    }
}
