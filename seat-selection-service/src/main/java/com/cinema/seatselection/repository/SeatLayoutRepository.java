package com.cinema.seatselection.repository;

import com.cinema.common.entity.SeatLayout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SeatLayoutRepository extends JpaRepository<SeatLayout, Long> {

    @Query("SELECT s FROM SeatLayout s WHERE s.cinemaRoomId = :cinemaRoomId AND s.active = true " +
           "ORDER BY s.rowLabel ASC, s.columnNumber ASC")
    List<SeatLayout> findActiveByCinemaRoomId(@Param("cinemaRoomId") Long cinemaRoomId);
}
