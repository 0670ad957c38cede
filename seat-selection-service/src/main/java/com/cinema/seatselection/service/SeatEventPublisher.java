package com.cinema.seatselection.service;

import com.cinema.common.dto.BookingDto;
import com.cinema.seatselection.hold.SeatHold;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes seat hold and booking events to Kafka for downstream consumers
 * (analytics, notifications). Publishing never fails the calling operation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SeatEventPublisher {

    private static final String SOURCE = "seat-selection-service";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topics.seat-hold-created:seat-hold-created}")
    private String seatHoldCreatedTopic;

    @Value("${kafka.topics.seat-hold-released:seat-hold-released}")
    private String seatHoldReleasedTopic;

    @Value("${kafka.topics.seat-hold-expired:seat-hold-expired}")
    private String seatHoldExpiredTopic;

    @Value("${kafka.topics.booking-confirmed:booking-confirmed}")
    private String bookingConfirmedTopic;

    /**
     * Publish seat hold created event
     */
    public void publishSeatHeld(SeatHold hold) {
        Map<String, Object> event = createSeatHoldEvent("SEAT_HOLD_CREATED", hold.getShowtimeId(), hold.getUserId(),
            List.of(hold.getSeatId()));
        event.put("expiresAt", hold.getExpiresAt().toString());
        send(seatHoldCreatedTopic, seatKey(hold), event);
    }

    /**
     * Publish seat hold released event (deselect, clear, disconnect, admin)
     */
    public void publishSeatsReleased(long showtimeId, Long userId, List<String> seatIds, ReleaseReason reason) {
        Map<String, Object> event = createSeatHoldEvent("SEAT_HOLD_RELEASED", showtimeId, userId, seatIds);
        event.put("reason", reason.name());
        send(seatHoldReleasedTopic, showtimeId + ":" + userId, event);
    }

    /**
     * Publish seat hold expired event (triggered by the expiration sweep)
     */
    public void publishSeatsExpired(long showtimeId, Long userId, List<String> seatIds) {
        Map<String, Object> event = createSeatHoldEvent("SEAT_HOLD_EXPIRED", showtimeId, userId, seatIds);
        send(seatHoldExpiredTopic, showtimeId + ":" + userId, event);
    }

    /**
     * Publish booking confirmed event
     */
    public void publishBookingConfirmed(BookingDto booking) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "BOOKING_CONFIRMED");
        event.put("bookingId", booking.getId());
        event.put("bookingReference", booking.getBookingReference());
        event.put("userId", booking.getUserId());
        event.put("showtimeId", booking.getShowtimeId());
        event.put("seatIds", booking.getSeatIds());
        event.put("totalAmount", booking.getTotalAmount());
        event.put("confirmedAt", booking.getConfirmedAt() != null ? booking.getConfirmedAt().toString() : null);
        event.put("timestamp", System.currentTimeMillis());
        event.put("source", SOURCE);
        send(bookingConfirmedTopic, booking.getBookingReference(), event);
    }

    private void send(String topic, String key, Map<String, Object> event) {
        try {
            String eventJson = objectMapper.writeValueAsString(event);

            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, eventJson);

            future.whenComplete((result, throwable) -> {
                if (throwable != null) {
                    log.error("Failed to publish {} event: {}", event.get("eventType"), key, throwable);
                } else {
                    log.debug("Published {} event: {} to partition: {}",
                             event.get("eventType"), key, result.getRecordMetadata().partition());
                }
            });

        } catch (Exception e) {
            log.error("Error creating {} event: {}", event.get("eventType"), key, e);
        }
    }

    private Map<String, Object> createSeatHoldEvent(String eventType, long showtimeId, Long userId, List<String> seatIds) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("showtimeId", showtimeId);
        event.put("userId", userId);
        event.put("seatIds", seatIds);
        event.put("seatCount", seatIds.size());
        event.put("timestamp", System.currentTimeMillis());
        event.put("source", SOURCE);
        return event;
    }

    private String seatKey(SeatHold hold) {
        return hold.getShowtimeId() + ":" + hold.getSeatId();
    }
}
