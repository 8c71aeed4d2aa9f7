package com.busreservation.reservation.service.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RedisTripLockService Unit Tests")
class RedisTripLockServiceTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisTripLockService lockService;

    @BeforeEach
    void setUp() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(stringRedisTemplate.execute(any(RedisScript.class), anyList(), any())).thenReturn(1L);
        lockService = new RedisTripLockService(stringRedisTemplate, 10000, 200);
    }

    @Test
    @DisplayName("Should run action and release lock by owner token")
    void executeWithLock_Acquired_RunsAndReleases() {
        when(valueOperations.setIfAbsent(eq("lock:trip:TR1"), anyString(), eq(Duration.ofMillis(10000))))
                .thenReturn(true);

        String result = lockService.executeWithLock("TR1", () -> "booked");

        assertThat(result).isEqualTo("booked");
        verify(stringRedisTemplate).execute(any(RedisScript.class), eq(List.of("lock:trip:TR1")), anyString());
    }

    @Test
    @DisplayName("Should release lock even when the action fails")
    void executeWithLock_ActionThrows_StillReleases() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);

        assertThatThrownBy(() -> lockService.executeWithLock("TR1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        verify(stringRedisTemplate).execute(any(RedisScript.class), anyList(), anyString());
    }

    @Test
    @DisplayName("Should give up after the wait timeout")
    void executeWithLock_HeldElsewhere_TimesOut() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertThatThrownBy(() -> lockService.executeWithLock("TR1", () -> "never"))
                .isInstanceOf(LockOperations.LockAcquisitionException.class)
                .hasMessageContaining("TR1");

        verify(stringRedisTemplate, never()).execute(any(RedisScript.class), anyList(), any());
    }
}
