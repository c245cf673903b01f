package com.wpanther.ocppcentral.ocpp;

import com.wpanther.ocppcentral.dto.DriverBilling;
import com.wpanther.ocppcentral.dto.MeterSample;
import com.wpanther.ocppcentral.dto.SessionCloseResult;
import com.wpanther.ocppcentral.dto.ocpp.AuthorizationStatus;
import com.wpanther.ocppcentral.dto.ocpp.AuthorizeRequest;
import com.wpanther.ocppcentral.dto.ocpp.AuthorizeResponse;
import com.wpanther.ocppcentral.dto.ocpp.BootNotificationRequest;
import com.wpanther.ocppcentral.dto.ocpp.BootNotificationResponse;
import com.wpanther.ocppcentral.dto.ocpp.EmptyConfirmation;
import com.wpanther.ocppcentral.dto.ocpp.HeartbeatRequest;
import com.wpanther.ocppcentral.dto.ocpp.HeartbeatResponse;
import com.wpanther.ocppcentral.dto.ocpp.IdTagInfo;
import com.wpanther.ocppcentral.dto.ocpp.MeterValue;
import com.wpanther.ocppcentral.dto.ocpp.MeterValuesRequest;
import com.wpanther.ocppcentral.dto.ocpp.RegistrationStatus;
import com.wpanther.ocppcentral.dto.ocpp.SampledValue;
import com.wpanther.ocppcentral.dto.ocpp.StartTransactionRequest;
import com.wpanther.ocppcentral.dto.ocpp.StartTransactionResponse;
import com.wpanther.ocppcentral.dto.ocpp.StatusNotificationRequest;
import com.wpanther.ocppcentral.dto.ocpp.StopTransactionRequest;
import com.wpanther.ocppcentral.dto.ocpp.StopTransactionResponse;
import com.wpanther.ocppcentral.entity.ChargePointEvent;
import com.wpanther.ocppcentral.entity.ChargeSession;
import com.wpanther.ocppcentral.entity.Connector;
import com.wpanther.ocppcentral.service.AuthorizationService;
import com.wpanther.ocppcentral.service.ChargePointService;
import com.wpanther.ocppcentral.service.ChargeSessionService;
import com.wpanther.ocppcentral.service.EventLogService;
import com.wpanther.ocppcentral.service.MeterSampleParser;
import com.wpanther.ocppcentral.service.PaymentSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Handlers for calls initiated by charge points, plus the fallback response of
 * each action. A handler that throws is answered with its fallback; secondary
 * writes that follow the primary effect are best effort so they cannot turn a
 * completed action into a fallback answer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChargePointRequestHandler {

    private final ChargePointService chargePointService;
    private final AuthorizationService authorizationService;
    private final ChargeSessionService chargeSessionService;
    private final EventLogService eventLogService;
    private final PaymentSyncService paymentSyncService;

    @Value("${ocpp.heartbeat.interval-seconds:300}")
    private int heartbeatIntervalSeconds;

    public BootNotificationResponse onBootNotification(ChargePointSession session, BootNotificationRequest request) {
        chargePointService.recordBoot(session.getContext().getChargerId(), request);
        return bootNotificationFallback();
    }

    public BootNotificationResponse bootNotificationFallback() {
        return BootNotificationResponse.builder()
                .currentTime(Instant.now())
                .interval(heartbeatIntervalSeconds)
                .status(RegistrationStatus.ACCEPTED)
                .build();
    }

    public HeartbeatResponse onHeartbeat(ChargePointSession session, HeartbeatRequest request) {
        Instant now = Instant.now();
        session.markHeartbeat(now);
        bestEffort(session, "heartbeat update",
                () -> chargePointService.recordHeartbeat(session.getContext().getChargerId(), now));
        return new HeartbeatResponse(now);
    }

    public HeartbeatResponse heartbeatFallback() {
        return new HeartbeatResponse(Instant.now());
    }

    public EmptyConfirmation onStatusNotification(ChargePointSession session, StatusNotificationRequest request) {
        ChargePointContext context = session.getContext();
        if (request.getConnectorId() != 0) {
            chargePointService.updateConnectorStatus(context, request.getConnectorId(), request.getStatus(),
                    request.getErrorCode());
        } else {
            log.info("Charge point {} reports {} ({})", context.getIdentity(), request.getStatus(),
                    request.getErrorCode());
        }
        bestEffort(session, "status event", () -> eventLogService.recordEvent(context,
                ChargePointEvent.TYPE_STATUS_NOTIFICATION, request.getConnectorId(), null,
                request.getTimestamp(), request));
        return EmptyConfirmation.INSTANCE;
    }

    public EmptyConfirmation emptyFallback() {
        return EmptyConfirmation.INSTANCE;
    }

    public AuthorizeResponse onAuthorize(ChargePointSession session, AuthorizeRequest request) {
        ChargePointContext context = session.getContext();
        AuthorizationStatus status = authorizationService.authorize(request.getIdTag(), context);
        bestEffort(session, "authorize event", () -> eventLogService.recordEvent(context,
                ChargePointEvent.TYPE_AUTHORIZE, null, null, Instant.now(),
                Map.of("idTag", request.getIdTag(), "status", status.getValue())));
        return new AuthorizeResponse(IdTagInfo.of(status));
    }

    /**
     * Chargers may hard-fail on a missing answer, so an internal error accepts the tag.
     */
    public AuthorizeResponse authorizeFallback() {
        return new AuthorizeResponse(IdTagInfo.of(AuthorizationStatus.ACCEPTED));
    }

    /**
     * Opens a session without re-checking authorization: OCPP 1.6 chargers may have
     * authorized the tag locally.
     */
    public StartTransactionResponse onStartTransaction(ChargePointSession session, StartTransactionRequest request) {
        ChargePointContext context = session.getContext();
        DriverBilling billing = authorizationService.resolveBilling(request.getIdTag());

        ChargeSession chargeSession = chargeSessionService.open(context, request.getIdTag(), request.getConnectorId(),
                request.getTimestamp(), billing.getDriverId(), billing.getTariffId());

        bestEffort(session, "connector status", () -> chargePointService.updateConnectorStatus(
                context, request.getConnectorId(), Connector.STATUS_CHARGING, null));
        bestEffort(session, "start event", () -> chargeSessionService.recordStart(
                context, chargeSession, request.getMeterStart(), request));

        return new StartTransactionResponse(IdTagInfo.of(AuthorizationStatus.ACCEPTED),
                Math.toIntExact(chargeSession.getId()));
    }

    public StartTransactionResponse startTransactionFallback() {
        return new StartTransactionResponse(IdTagInfo.of(AuthorizationStatus.INVALID), 0);
    }

    public StopTransactionResponse onStopTransaction(ChargePointSession session, StopTransactionRequest request) {
        ChargePointContext context = session.getContext();
        long sessionId = request.getTransactionId();

        Optional<SessionCloseResult> closed = chargeSessionService.close(sessionId, request.getTimestamp(),
                request.getReason(), request.getMeterStop());

        if (closed.isEmpty()) {
            log.warn("StopTransaction from {} for unknown transaction {}", context.getIdentity(), sessionId);
        } else if (!closed.get().isAlreadyClosed()) {
            SessionCloseResult result = closed.get();
            bestEffort(session, "connector status", () -> chargePointService.updateConnectorStatus(
                    context, result.getConnectorId(), Connector.STATUS_AVAILABLE, null));
            bestEffort(session, "stop event", () -> chargeSessionService.recordStop(
                    context, result, request.getTimestamp(), request.getMeterStop(), request));
            if (request.getTransactionData() != null) {
                for (MeterValue meterValue : request.getTransactionData()) {
                    recordMeterValue(session, result.getConnectorId(), sessionId, meterValue);
                }
            }
        }

        // Repeated stops retry a payment opening that failed earlier; the call reuses an existing transaction
        if (closed.isPresent()) {
            bestEffort(session, "payment", () -> paymentSyncService.onSessionCompleted(sessionId));
        }
        return stopTransactionFallback();
    }

    public StopTransactionResponse stopTransactionFallback() {
        return new StopTransactionResponse(IdTagInfo.of(AuthorizationStatus.ACCEPTED));
    }

    public EmptyConfirmation onMeterValues(ChargePointSession session, MeterValuesRequest request) {
        ChargePointContext context = session.getContext();
        Long sessionId = request.getTransactionId() != null
                ? Long.valueOf(request.getTransactionId())
                : findOpenSessionId(context, request.getConnectorId());

        for (MeterValue meterValue : request.getMeterValue()) {
            recordMeterValue(session, request.getConnectorId(), sessionId, meterValue);
        }
        return EmptyConfirmation.INSTANCE;
    }

    private Long findOpenSessionId(ChargePointContext context, int connectorId) {
        if (connectorId == 0) {
            return null;
        }
        try {
            return chargeSessionService.findOpenSession(context.getChargerId(), connectorId)
                    .map(ChargeSession::getId)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.error("Open session lookup failed for {}/{}", context.getIdentity(), connectorId, e);
            return null;
        }
    }

    private void recordMeterValue(ChargePointSession session, Integer connectorId, Long sessionId,
                                  MeterValue meterValue) {
        for (SampledValue sampledValue : meterValue.getSampledValue()) {
            MeterSample sample = MeterSampleParser.parse(meterValue.getTimestamp(), sampledValue);
            bestEffort(session, "meter sample", () -> chargeSessionService.recordMeterSample(
                    session.getContext(), connectorId, sessionId, sample));
        }
    }

    private void bestEffort(ChargePointSession session, String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Failed to store {} for {}", what, session.getIdentity(), e);
        }
    }
}
