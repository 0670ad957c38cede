package com.cinema.seatselection.controller;

import com.cinema.common.dto.ReleaseUserSeatsRequest;
import com.cinema.common.dto.SeatHoldDto;
import com.cinema.common.dto.SeatMapSnapshot;
import com.cinema.common.dto.SeatStatisticsDto;
import com.cinema.seatselection.exception.SeatSelectionException;
import com.cinema.seatselection.service.SeatSelectionCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/seat-selection")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Seat Selection Controller", description = "Operational view of live seat holds")
public class SeatSelectionController {

    private final SeatSelectionCoordinator coordinator;

    @GetMapping("/showtime/{showtimeId}")
    @Operation(
        summary = "Get seat map of a showtime",
        description = "Current state of every seat: AVAILABLE, HELD (with holder and expiry) or CONFIRMED."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Seat map returned"),
        @ApiResponse(responseCode = "400", description = "Unknown showtime"),
        @ApiResponse(responseCode = "503", description = "Booking store unavailable")
    })
    public ResponseEntity<SeatMapSnapshot> getSeatMap(
            @Parameter(description = "Showtime ID") @PathVariable Long showtimeId) {

        log.debug("Seat map request for showtime: {}", showtimeId);
        return ResponseEntity.ok(coordinator.snapshot(showtimeId));
    }

    @GetMapping("/showtime/{showtimeId}/expiring")
    @Operation(
        summary = "List holds about to expire",
        description = "Holds of the showtime whose expiry falls within the given number of seconds."
    )
    public ResponseEntity<List<SeatHoldDto>> getExpiringHolds(
            @Parameter(description = "Showtime ID") @PathVariable Long showtimeId,
            @Parameter(description = "Look-ahead window in seconds") @RequestParam(defaultValue = "60") long withinSeconds) {

        return ResponseEntity.ok(coordinator.expiringHolds(showtimeId, withinSeconds));
    }

    @GetMapping("/statistics")
    @Operation(
        summary = "Seat hold statistics",
        description = "Hold counts by status, connected sessions, pending disconnect releases and hold TTL."
    )
    public ResponseEntity<SeatStatisticsDto> getStatistics() {
        return ResponseEntity.ok(coordinator.statistics());
    }

    @PostMapping("/release-user-seats")
    @Operation(
        summary = "Release all holds of a user",
        description = "Administrative release of a user's holds, in one showtime or in every showtime. " +
                     "Affected showtimes receive a fresh seat map."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Holds released"),
        @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<Map<String, Object>> releaseUserSeats(@Valid @RequestBody ReleaseUserSeatsRequest request) {
        log.info("Release request for user: {} showtime: {}", request.getUserId(), request.getShowtimeId());

        try {
            int released = coordinator.releaseUserSeats(request.getUserId(), request.getShowtimeId());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("userId", request.getUserId());
            body.put("releasedSeats", released);
            return ResponseEntity.ok(body);

        } catch (SeatSelectionException e) {
            log.warn("Release failed for user: {} - {}", request.getUserId(), e.getMessage());
            throw e;
        }
    }

    @PostMapping("/cleanup")
    @Operation(
        summary = "Run expiration sweep now",
        description = "Expires every hold whose TTL has passed and broadcasts the affected seat maps."
    )
    public ResponseEntity<Map<String, Object>> runCleanup() {
        int expired = coordinator.runCleanup();
        log.info("Manual cleanup expired {} hold(s)", expired);
        return ResponseEntity.ok(Map.of("expiredHolds", expired));
    }

    @GetMapping("/health")
    @Operation(
        summary = "Health check endpoint",
        description = "Coordinator state with session and hold counts."
    )
    public ResponseEntity<Map<String, Object>> health() {
        SeatStatisticsDto statistics = coordinator.statistics();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", coordinator.isRunning() ? "UP" : "DOWN");
        body.put("connectedSessions", statistics.getConnectedSessions());
        body.put("heldSeats", statistics.getHeldSeats());
        body.put("pendingReleases", statistics.getPendingReleases());

        HttpStatus status = coordinator.isRunning() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }
}
