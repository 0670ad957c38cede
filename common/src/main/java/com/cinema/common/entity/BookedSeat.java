package com.cinema.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;

/**
 * A seat assigned by a live booking. Rows are deleted when their booking is
 * cancelled, so the unique constraint on (showtime, seat) only ever covers seats
 * that are currently sold. It is the durable guard against two bookings sharing a
 * seat, including bookings written by other service instances.
 */
@Entity
@Table(name = "booked_seats",
    uniqueConstraints = @UniqueConstraint(name = "uk_booked_seat_showtime_seat",
        columnNames = {"showtime_id", "seat_id"}),
    indexes = @Index(name = "idx_booked_seat_booking", columnList = "booking_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookedSeat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "booking_id", nullable = false)
    private Booking booking;

    @NotNull
    @Column(name = "showtime_id", nullable = false)
    private Long showtimeId;

    @NotBlank
    @Size(max = 16)
    @Column(name = "seat_id", nullable = false, length = 16)
    private String seatId;
}
