package com.cinema.common.entity;

import com.cinema.common.enums.ShowtimeStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "showtimes", indexes = {
    @Index(name = "idx_showtime_room", columnList = "cinema_room_id"),
    @Index(name = "idx_showtime_start", columnList = "start_time")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Showtime {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "cinema_room_id", nullable = false)
    private Long cinemaRoomId;

    @Size(max = 200)
    @Column(name = "movie_title")
    private String movieTitle;

    @NotNull
    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @NotNull
    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private ShowtimeStatus status;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public boolean isBookable() {
        return status != null && status.isBookable();
    }
}
