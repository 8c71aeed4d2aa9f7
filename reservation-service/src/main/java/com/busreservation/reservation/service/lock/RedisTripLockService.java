package com.busreservation.reservation.service.lock;

import com.busreservation.reservation.constants.ReservationConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Cross-instance trip locks on Redis ({@code SET NX PX} plus owner-checked delete).
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "reservation.lock.mode", havingValue = ReservationConstants.LOCK_MODE_REDIS)
public class RedisTripLockService implements LockOperations {

    private static final long RETRY_DELAY_MS = 50;

    private static final String RELEASE_LOCK_SCRIPT = "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
            "return redis.call('DEL', KEYS[1]) " +
            "else return 0 end";

    private final StringRedisTemplate stringRedisTemplate;
    private final Duration leaseTimeout;
    private final Duration waitTimeout;

    public RedisTripLockService(
            StringRedisTemplate stringRedisTemplate,
            @Value("${reservation.lock.lease-timeout-ms:" + ReservationConstants.DEFAULT_LOCK_LEASE_TIMEOUT_MS + "}")
            long leaseTimeoutMs,
            @Value("${reservation.lock.wait-timeout-ms:" + ReservationConstants.DEFAULT_LOCK_WAIT_TIMEOUT_MS + "}")
            long waitTimeoutMs) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.leaseTimeout = Duration.ofMillis(leaseTimeoutMs);
        this.waitTimeout = Duration.ofMillis(waitTimeoutMs);
    }

    @Override
    public <T> T executeWithLock(String tripId, Supplier<T> action) {
        String lockKey = ReservationConstants.REDIS_TRIP_LOCK_PREFIX + tripId;
        String lockValue = UUID.randomUUID().toString();

        if (!acquire(tripId, lockKey, lockValue)) {
            throw new LockAcquisitionException("Failed to acquire lock for trip: " + tripId);
        }

        try {
            return action.get();
        } finally {
            release(lockKey, lockValue);
        }
    }

    private boolean acquire(String tripId, String lockKey, String lockValue) {
        long deadline = System.currentTimeMillis() + waitTimeout.toMillis();

        while (System.currentTimeMillis() < deadline) {
            Boolean acquired = stringRedisTemplate.opsForValue()
                    .setIfAbsent(lockKey, lockValue, leaseTimeout);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Acquired lock: tripId={}, lockKey={}", tripId, lockKey);
                return true;
            }

            try {
                Thread.sleep(RETRY_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Lock acquisition interrupted: tripId={}", tripId);
                return false;
            }
        }

        log.warn("Failed to acquire lock within timeout: tripId={}, waitTimeout={}ms",
                tripId, waitTimeout.toMillis());
        return false;
    }

    private void release(String lockKey, String lockValue) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>(RELEASE_LOCK_SCRIPT, Long.class);
        Long result = stringRedisTemplate.execute(script, Collections.singletonList(lockKey), lockValue);

        if (result != null && result == 1L) {
            log.debug("Released lock: lockKey={}", lockKey);
        } else {
            log.warn("Lock release failed (expired or stolen): lockKey={}", lockKey);
        }
    }
}
