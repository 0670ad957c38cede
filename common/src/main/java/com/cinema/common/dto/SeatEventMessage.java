package com.cinema.common.dto;

import lombok.*;

/**
 * Envelope of every real-time message: {@code {"event": "...", "data": {...}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatEventMessage {

    private String event;

    private Object data;
}
