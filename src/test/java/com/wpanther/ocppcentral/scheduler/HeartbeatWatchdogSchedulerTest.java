package com.wpanther.ocppcentral.scheduler;

import com.wpanther.ocppcentral.dto.ConnectionStats;
import com.wpanther.ocppcentral.ocpp.ChargePointSession;
import com.wpanther.ocppcentral.ocpp.ConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for HeartbeatWatchdogScheduler
 */
@ExtendWith(MockitoExtension.class)
class HeartbeatWatchdogSchedulerTest {

    @Mock
    private ConnectionRegistry connectionRegistry;

    @InjectMocks
    private HeartbeatWatchdogScheduler scheduler;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(scheduler, "heartbeatIntervalSeconds", 300);
        ReflectionTestUtils.setField(scheduler, "timeoutMultiplier", 3);
    }

    @Test
    void testEvictSilentConnections_ClosesIdleSessionsOnly() {
        // Arrange
        ChargePointSession idle = mock(ChargePointSession.class);
        ChargePointSession alive = mock(ChargePointSession.class);
        when(idle.isIdle(any(Instant.class), eq(Duration.ofSeconds(900)))).thenReturn(true);
        when(idle.getStats()).thenReturn(ConnectionStats.builder().identity("CP-1").build());
        when(alive.isIdle(any(Instant.class), eq(Duration.ofSeconds(900)))).thenReturn(false);
        when(connectionRegistry.activeSessions()).thenReturn(List.of(idle, alive));

        // Act
        scheduler.evictSilentConnections();

        // Assert
        verify(idle).close(ChargePointSession.CLOSE_GOING_AWAY, "Heartbeat timeout");
        verify(alive, never()).close(anyInt(), anyString());
    }

    @Test
    void testEvictSilentConnections_NoConnections() {
        // Arrange
        when(connectionRegistry.activeSessions()).thenReturn(Collections.emptyList());

        // Act
        scheduler.evictSilentConnections();

        // Assert
        verify(connectionRegistry).activeSessions();
    }

    @Test
    void testEvictSilentConnections_HandlesException() {
        // Arrange
        ChargePointSession idle = mock(ChargePointSession.class);
        when(idle.isIdle(any(Instant.class), any(Duration.class))).thenReturn(true);
        when(idle.getStats()).thenReturn(ConnectionStats.builder().identity("CP-1").build());
        doThrow(new RuntimeException("Transport failure")).when(idle).close(anyInt(), anyString());
        when(connectionRegistry.activeSessions()).thenReturn(List.of(idle));

        // Act - should not throw exception
        scheduler.evictSilentConnections();

        // Assert
        verify(idle).close(ChargePointSession.CLOSE_GOING_AWAY, "Heartbeat timeout");
    }
}
