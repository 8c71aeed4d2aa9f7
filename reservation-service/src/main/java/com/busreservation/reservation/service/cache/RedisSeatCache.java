package com.busreservation.reservation.service.cache;

import com.busreservation.reservation.constants.ReservationConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "reservation.cache.enabled", havingValue = "true")
public class RedisSeatCache implements SeatCacheOperations {

    private final StringRedisTemplate stringRedisTemplate;

    @Override
    public void setSeats(String tripId, int seats) {
        String key = formatSeatsKey(tripId);
        try {
            stringRedisTemplate.opsForValue().set(key, String.valueOf(seats));
            log.debug("Set seats: tripId={}, seats={}", tripId, seats);
        } catch (Exception e) {
            log.error("Failed to set seats for trip {}: {}", tripId, e.getMessage());
        }
    }

    @Override
    public Optional<Integer> getSeats(String tripId) {
        String key = formatSeatsKey(tripId);
        try {
            String value = stringRedisTemplate.opsForValue().get(key);
            if (value != null) {
                return Optional.of(Integer.parseInt(value));
            }
        } catch (Exception e) {
            log.warn("Failed to get seats for trip {}: {}", tripId, e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public void deleteSeats(String tripId) {
        String key = formatSeatsKey(tripId);
        try {
            stringRedisTemplate.delete(key);
            log.debug("Deleted seats key: tripId={}", tripId);
        } catch (Exception e) {
            log.warn("Failed to delete seats for trip {}: {}", tripId, e.getMessage());
        }
    }

    public String formatSeatsKey(String tripId) {
        return String.format(ReservationConstants.REDIS_TRIP_SEATS_KEY_PATTERN, tripId);
    }
}
