package com.cinema.seatselection.service;

import com.cinema.common.dto.SeatHoldDto;
import com.cinema.seatselection.hold.HoldStatus;
import com.cinema.seatselection.hold.SeatHold;
import com.cinema.seatselection.hold.SeatKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

@Service
@Slf4j
public class RedisHoldMirror implements HoldMirror {

    private static final String SEAT_HOLD_KEY_PATTERN = "seat:*:HELD";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean enabled;

    public RedisHoldMirror(StringRedisTemplate redisTemplate,
                           ObjectMapper objectMapper,
                           Clock clock,
                           @Value("${seat-selection.hold.mirror.enabled:true}") boolean enabled) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.enabled = enabled;
    }

    public static String seatHoldKey(long showtimeId, String seatId) {
        return String.format("seat:%d:%s:HELD", showtimeId, seatId);
    }

    /**
     * Mirror a hold with a TTL matching its deadline
     */
    @Override
    public void record(SeatHold hold) {
        if (!enabled) {
            return;
        }
        try {
            Duration ttl = Duration.between(clock.instant(), hold.getExpiresAt());
            if (ttl.isNegative() || ttl.isZero()) {
                return;
            }
            String holdJson = objectMapper.writeValueAsString(toDto(hold));
            redisTemplate.opsForValue().set(seatHoldKey(hold.getShowtimeId(), hold.getSeatId()), holdJson, ttl);

            log.debug("Mirrored hold {} with TTL: {} seconds", hold.getSeat(), ttl.getSeconds());

        } catch (JsonProcessingException e) {
            log.error("Error serializing seat hold: {}", hold.getSeat(), e);
        } catch (Exception e) {
            log.error("Error mirroring seat hold: {}", hold.getSeat(), e);
        }
    }

    @Override
    public void remove(Collection<SeatKey> seats) {
        if (!enabled || seats.isEmpty()) {
            return;
        }
        try {
            List<String> keys = seats.stream()
                .map(seat -> seatHoldKey(seat.getShowtimeId(), seat.getSeatId()))
                .toList();
            redisTemplate.delete(keys);
            log.debug("Removed {} mirrored holds", keys.size());
        } catch (Exception e) {
            log.error("Error removing mirrored holds: {}", seats, e);
        }
    }

    @Override
    public List<SeatHold> loadActiveHolds() {
        if (!enabled) {
            return List.of();
        }
        List<SeatHold> holds = new ArrayList<>();
        try {
            Set<String> keys = redisTemplate.keys(SEAT_HOLD_KEY_PATTERN);
            if (keys == null || keys.isEmpty()) {
                return holds;
            }
            for (String key : keys) {
                String holdJson = redisTemplate.opsForValue().get(key);
                if (holdJson == null) {
                    continue; // expired between KEYS and GET
                }
                try {
                    holds.add(fromDto(objectMapper.readValue(holdJson, SeatHoldDto.class)));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable mirrored hold {}: {}", key, e.getOriginalMessage());
                }
            }
        } catch (Exception e) {
            log.error("Error loading mirrored holds", e);
        }
        return holds;
    }

    private SeatHoldDto toDto(SeatHold hold) {
        return SeatHoldDto.builder()
            .showtimeId(hold.getShowtimeId())
            .seatId(hold.getSeatId())
            .userId(hold.getUserId())
            .acquiredAt(hold.getAcquiredAt())
            .expiresAt(hold.getExpiresAt())
            .status(hold.getStatus().name())
            .build();
    }

    private SeatHold fromDto(SeatHoldDto dto) {
        return SeatHold.builder()
            .seat(SeatKey.of(dto.getShowtimeId(), dto.getSeatId()))
            .userId(dto.getUserId())
            .acquiredAt(dto.getAcquiredAt())
            .expiresAt(dto.getExpiresAt())
            .status(HoldStatus.HELD)
            .build();
    }
}
