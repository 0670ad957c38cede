package com.cinema.seatselection.repository;

import com.cinema.common.entity.BookedSeat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Booked seat rows exist only for live bookings; cancelling a booking deletes them.
 */
@Repository
public interface BookedSeatRepository extends JpaRepository<BookedSeat, Long> {

    @Query("SELECT bs.seatId FROM BookedSeat bs WHERE bs.showtimeId = :showtimeId")
    List<String> findBookedSeatIds(@Param("showtimeId") Long showtimeId);

    @Query("SELECT bs.seatId FROM BookedSeat bs WHERE bs.showtimeId = :showtimeId AND bs.seatId IN :seatIds")
    List<String> findBookedSeatIdsIn(@Param("showtimeId") Long showtimeId,
                                     @Param("seatIds") Collection<String> seatIds);

    default boolean isBooked(Long showtimeId, String seatId) {
        return !findBookedSeatIdsIn(showtimeId, List.of(seatId)).isEmpty();
    }
}
