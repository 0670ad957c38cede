package com.cinema.seatselection.service;

import com.cinema.seatselection.hold.HoldStore;
import com.cinema.seatselection.session.SeatEventBroadcaster;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Frees seats of bookings cancelled elsewhere. The cancelling service deletes the
 * booked seat rows; this listener drops the in-memory CONFIRMED entries and
 * pushes a fresh seat map to viewers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "seat-selection.kafka.consumer.enabled", havingValue = "true", matchIfMissing = true)
public class BookingCancellationConsumer {

    private final HoldStore holdStore;
    private final SeatEventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topics.booking-cancelled:booking-cancelled}",
        groupId = "${kafka.consumer.group-id:seat-selection-service}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void onBookingCancelled(ConsumerRecord<String, String> record) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> event = objectMapper.readValue(record.value(), Map.class);

            String eventType = (String) event.get("eventType");

            if ("BOOKING_CANCELLED".equals(eventType)) {
                Long showtimeId = ((Number) event.get("showtimeId")).longValue();
                @SuppressWarnings("unchecked")
                List<String> seatIds = (List<String>) event.get("seatIds");

                handleCancellation(showtimeId, seatIds, (String) event.get("bookingReference"));
            } else {
                log.debug("Ignoring event type: {}", eventType);
            }

        } catch (Exception e) {
            log.error("Failed to process booking cancellation: key={}", record.key(), e);
        }
    }

    private void handleCancellation(Long showtimeId, List<String> seatIds, String bookingReference) {
        if (seatIds == null || seatIds.isEmpty()) {
            log.debug("Cancellation {} carries no seats, skipping", bookingReference);
            return;
        }

        int cleared = holdStore.clearConfirmed(showtimeId, seatIds);
        log.info("Booking {} cancelled: showtime={} seats={} ({} cleared in memory)",
                bookingReference, showtimeId, seatIds, cleared);

        broadcaster.publishSnapshot(showtimeId);
    }
}
