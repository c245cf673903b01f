package com.wpanther.ocppcentral.ocpp;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds {@link ChargePointSession}s wired to the shared codec, dispatcher,
 * timeout scheduler and connection registry.
 */
@Component
@RequiredArgsConstructor
public class ChargePointSessionFactory {

    private final OcppFrameCodec codec;
    private final OcppMessageDispatcher dispatcher;
    private final ScheduledExecutorService ocppCallScheduler;
    private final ConnectionRegistry connectionRegistry;

    @Value("${ocpp.call.timeout-seconds:30}")
    private long callTimeoutSeconds;

    public ChargePointSession create(String identity, OcppTransport transport) {
        return new ChargePointSession(identity, transport, codec, dispatcher, ocppCallScheduler,
                Duration.ofSeconds(callTimeoutSeconds),
                session -> connectionRegistry.unregister(session.getIdentity(), session));
    }
}
