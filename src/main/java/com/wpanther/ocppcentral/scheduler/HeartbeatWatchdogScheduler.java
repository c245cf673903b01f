package com.wpanther.ocppcentral.scheduler;

import com.wpanther.ocppcentral.ocpp.ChargePointSession;
import com.wpanther.ocppcentral.ocpp.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Disconnects chargers that have been silent for longer than the heartbeat
 * interval times the configured multiplier. Any inbound frame counts as activity.
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class HeartbeatWatchdogScheduler {

    private final ConnectionRegistry connectionRegistry;

    @Value("${ocpp.heartbeat.interval-seconds:300}")
    private int heartbeatIntervalSeconds;

    @Value("${ocpp.heartbeat.timeout-multiplier:3}")
    private int timeoutMultiplier;

    /**
     * Runs every minute by default (configurable via ocpp.heartbeat.check-interval-ms)
     */
    @Scheduled(fixedDelayString = "${ocpp.heartbeat.check-interval-ms:60000}",
            initialDelayString = "${ocpp.heartbeat.check-interval-ms:60000}")
    public void evictSilentConnections() {
        Duration window = Duration.ofSeconds((long) heartbeatIntervalSeconds * timeoutMultiplier);
        log.debug("Checking connection liveness (window: {}s)", window.getSeconds());

        try {
            Instant now = Instant.now();
            int evicted = 0;
            for (ChargePointSession session : connectionRegistry.activeSessions()) {
                if (session.isIdle(now, window)) {
                    log.warn("No traffic from {} since {}, disconnecting",
                            session.getIdentity(), session.getStats().getLastActivity());
                    session.close(ChargePointSession.CLOSE_GOING_AWAY, "Heartbeat timeout");
                    evicted++;
                }
            }
            if (evicted > 0) {
                log.info("Liveness check completed: {} connections evicted", evicted);
            }
        } catch (Exception e) {
            log.error("Error during connection liveness check", e);
        }
    }
}
