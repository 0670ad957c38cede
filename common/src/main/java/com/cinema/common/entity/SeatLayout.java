package com.cinema.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;

/**
 * One physical seat of a cinema room. The seat id used on the seat map is the
 * row label followed by the column number, e.g. {@code A6}.
 */
@Entity
@Table(name = "seat_layouts",
    uniqueConstraints = @UniqueConstraint(name = "uk_seat_layout_position",
        columnNames = {"cinema_room_id", "row_label", "column_number"}),
    indexes = @Index(name = "idx_seat_layout_room", columnList = "cinema_room_id, active"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatLayout {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "cinema_room_id", nullable = false)
    private Long cinemaRoomId;

    @NotBlank
    @Size(max = 5)
    @Column(name = "row_label", nullable = false, length = 5)
    private String rowLabel;

    @NotNull
    @Positive
    @Column(name = "column_number", nullable = false)
    private Integer columnNumber;

    @Size(max = 30)
    @Column(name = "seat_type", length = 30)
    private String seatType;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    public String getSeatId() {
        return rowLabel + columnNumber;
    }
}
