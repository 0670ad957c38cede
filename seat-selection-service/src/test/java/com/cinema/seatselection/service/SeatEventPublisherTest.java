package com.cinema.seatselection.service;

import com.cinema.common.dto.BookingDto;
import com.cinema.seatselection.hold.HoldStatus;
import com.cinema.seatselection.hold.SeatHold;
import com.cinema.seatselection.hold.SeatKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeatEventPublisherTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private SeatEventPublisher publisher;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @BeforeEach
    void setUp() {
        publisher = new SeatEventPublisher(kafkaTemplate, objectMapper);
        ReflectionTestUtils.setField(publisher, "seatHoldCreatedTopic", "seat-hold-created");
        ReflectionTestUtils.setField(publisher, "seatHoldReleasedTopic", "seat-hold-released");
        ReflectionTestUtils.setField(publisher, "seatHoldExpiredTopic", "seat-hold-expired");
        ReflectionTestUtils.setField(publisher, "bookingConfirmedTopic", "booking-confirmed");
    }

    // ─── Helper methods ──────────────────────────────────────────────────

    private SeatHold sampleHold() {
        Instant now = Instant.parse("2026-01-10T18:00:00Z");
        return SeatHold.builder()
            .seat(SeatKey.of(1L, "A1"))
            .userId(10L)
            .connectionId("c1")
            .acquiredAt(now)
            .expiresAt(now.plusSeconds(300))
            .status(HoldStatus.HELD)
            .build();
    }

    private CompletableFuture<SendResult<String, String>> successFuture() {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("test-topic", 0), 0L, 0, 0L, 0, 0);
        ProducerRecord<String, String> producerRecord = new ProducerRecord<>("topic", "key", "value");
        return CompletableFuture.completedFuture(new SendResult<>(producerRecord, metadata));
    }

    private CompletableFuture<SendResult<String, String>> failureFuture() {
        CompletableFuture<SendResult<String, String>> future = new CompletableFuture<>();
        future.completeExceptionally(new RuntimeException("Kafka send failed"));
        return future;
    }

    private JsonNode sentPayload(String topic, String key) throws Exception {
        ArgumentCaptor<String> jsonCaptor = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(topic), eq(key), jsonCaptor.capture());
        return objectMapper.readTree(jsonCaptor.getValue());
    }

    // ─── publishSeatHeld ─────────────────────────────────────────────────

    @Test
    void publishSeatHeld_KeyedBySeat() throws Exception {
        when(kafkaTemplate.send(eq("seat-hold-created"), eq("1:A1"), anyString())).thenReturn(successFuture());

        publisher.publishSeatHeld(sampleHold());

        JsonNode event = sentPayload("seat-hold-created", "1:A1");
        assertEquals("SEAT_HOLD_CREATED", event.get("eventType").asText());
        assertEquals(10L, event.get("userId").asLong());
        assertEquals("A1", event.get("seatIds").get(0).asText());
        assertEquals("seat-selection-service", event.get("source").asText());
        assertTrue(event.has("expiresAt"));
    }

    @Test
    void publishSeatHeld_KafkaSendFails_DoesNotThrow() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(failureFuture());

        assertDoesNotThrow(() -> publisher.publishSeatHeld(sampleHold()));
    }

    @Test
    void publishSeatHeld_SerializationError_CaughtGracefully() throws Exception {
        ObjectMapper brokenMapper = mock(ObjectMapper.class);
        when(brokenMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") { });
        SeatEventPublisher brokenPublisher = new SeatEventPublisher(kafkaTemplate, brokenMapper);
        ReflectionTestUtils.setField(brokenPublisher, "seatHoldCreatedTopic", "seat-hold-created");

        assertDoesNotThrow(() -> brokenPublisher.publishSeatHeld(sampleHold()));
        verifyNoInteractions(kafkaTemplate);
    }

    // ─── released / expired / booked ─────────────────────────────────────

    @Test
    void publishSeatsReleased_CarriesReason() throws Exception {
        when(kafkaTemplate.send(eq("seat-hold-released"), eq("1:10"), anyString())).thenReturn(successFuture());

        publisher.publishSeatsReleased(1L, 10L, List.of("A1", "A2"), ReleaseReason.DISCONNECTED);

        JsonNode event = sentPayload("seat-hold-released", "1:10");
        assertEquals("SEAT_HOLD_RELEASED", event.get("eventType").asText());
        assertEquals("DISCONNECTED", event.get("reason").asText());
        assertEquals(2, event.get("seatCount").asInt());
    }

    @Test
    void publishSeatsExpired_Success() throws Exception {
        when(kafkaTemplate.send(eq("seat-hold-expired"), eq("1:10"), anyString())).thenReturn(successFuture());

        publisher.publishSeatsExpired(1L, 10L, List.of("A1"));

        assertEquals("SEAT_HOLD_EXPIRED", sentPayload("seat-hold-expired", "1:10").get("eventType").asText());
    }

    @Test
    void publishBookingConfirmed_KeyedByReference() throws Exception {
        when(kafkaTemplate.send(eq("booking-confirmed"), eq("ABCD1234"), anyString())).thenReturn(successFuture());

        publisher.publishBookingConfirmed(BookingDto.builder()
            .id(7L)
            .bookingReference("ABCD1234")
            .userId(10L)
            .showtimeId(1L)
            .seatIds(List.of("A1"))
            .totalAmount(new BigDecimal("12.50"))
            .status("CONFIRMED")
            .build());

        JsonNode event = sentPayload("booking-confirmed", "ABCD1234");
        assertEquals("BOOKING_CONFIRMED", event.get("eventType").asText());
        assertEquals(7L, event.get("bookingId").asLong());
        assertTrue(event.get("confirmedAt").isNull());
    }
}
