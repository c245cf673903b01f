package com.wpanther.ocppcentral.service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.ocppcentral.dto.MeterSample;
import com.wpanther.ocppcentral.dto.SessionCloseResult;
import com.wpanther.ocppcentral.dto.SessionStopUpdate;
import com.wpanther.ocppcentral.dto.TariffQuote;
import com.wpanther.ocppcentral.dto.TimelinePoint;
import com.wpanther.ocppcentral.entity.ChargePointEvent;
import com.wpanther.ocppcentral.entity.ChargeSession;
import com.wpanther.ocppcentral.ocpp.ChargePointContext;
import com.wpanther.ocppcentral.repository.ChargePointEventRepository;
import com.wpanther.ocppcentral.repository.ChargeSessionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Charge session lifecycle and the telemetry derived from its meter samples
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChargeSessionService {

    private final ChargeSessionRepository sessionRepository;
    private final ChargePointEventRepository eventRepository;
    private final EventLogService eventLogService;
    private final TariffService tariffService;

    // Serializes max+1 id assignment; each save commits on its own
    private final ReentrantLock idLock = new ReentrantLock();

    /**
     * Open a session with the next free id. OCPP does not let the central system refuse a
     * StartTransaction, so an already open session on the connector is logged and left open.
     */
    public ChargeSession open(ChargePointContext context, String idTag, int connectorId, Instant startTime,
                              Long driverId, Long tariffId) {
        sessionRepository.findFirstByChargerIdAndConnectorIdAndEndedAtIsNullOrderByStartedAtDesc(
                context.getChargerId(), connectorId)
                .ifPresent(open -> log.warn("Connector {}/{} already has open session {}",
                        context.getIdentity(), connectorId, open.getId()));

        idLock.lock();
        try {
            long sessionId = sessionRepository.findMaxId().orElse(0L) + 1;
            ChargeSession session = ChargeSession.builder()
                    .id(sessionId)
                    .companyId(context.getCompanyId())
                    .siteId(context.getSiteId())
                    .chargerId(context.getChargerId())
                    .connectorId(connectorId)
                    .idTag(idTag)
                    .driverId(driverId)
                    .tariffId(tariffId)
                    .startedAt(startTime)
                    .status(ChargeSession.STATUS_STARTED)
                    .energyKwh(0.0)
                    .createdAt(Instant.now())
                    .build();
            ChargeSession saved = sessionRepository.saveAndFlush(session);
            log.info("Opened session {} on {}/{} for idTag {} (driver={}, tariff={})",
                    sessionId, context.getIdentity(), connectorId, idTag, driverId, tariffId);
            return saved;
        } finally {
            idLock.unlock();
        }
    }

    /**
     * Record the meter register at session start. It is the session's first energy sample.
     */
    public void recordStart(ChargePointContext context, ChargeSession session, double meterStartWh, Object payload) {
        eventLogService.recordTransactionEvent(context, ChargePointEvent.TYPE_START_TRANSACTION,
                session.getConnectorId(), session.getId(), session.getStartedAt(), meterStartWh, payload);
    }

    /**
     * Record the meter register at session stop
     */
    public void recordStop(ChargePointContext context, SessionCloseResult result, Instant endTime,
                           double meterStopWh, Object payload) {
        eventLogService.recordTransactionEvent(context, ChargePointEvent.TYPE_STOP_TRANSACTION,
                result.getConnectorId(), result.getSessionId(), endTime, meterStopWh, payload);
    }

    /**
     * Append a meter sample. Energy samples of an open session also refresh its running energy.
     */
    public void recordMeterSample(ChargePointContext context, Integer connectorId, Long sessionId, MeterSample sample) {
        eventLogService.recordMeterSample(context, connectorId, sessionId, sample);
        if (sessionId != null && sample.hasEnergy()) {
            updateRunningEnergy(sessionId, sample.getEnergyWh());
        }
    }

    @Transactional(readOnly = true)
    public Optional<ChargeSession> findOpenSession(Long chargerId, int connectorId) {
        return sessionRepository.findFirstByChargerIdAndConnectorIdAndEndedAtIsNullOrderByStartedAtDesc(
                chargerId, connectorId);
    }

    @Transactional(readOnly = true)
    public Optional<ChargeSession> findSession(Long sessionId) {
        return sessionRepository.findById(sessionId);
    }

    /**
     * Close a session: duration, energy from the earliest energy sample to {@code meterStopWh},
     * and cost. Closing a closed session returns the stored values.
     *
     * @return empty when no session has this id
     */
    @Transactional
    public Optional<SessionCloseResult> close(Long sessionId, Instant endTime, String reason, double meterStopWh) {
        Optional<ChargeSession> found = sessionRepository.findById(sessionId);
        if (found.isEmpty()) {
            log.warn("Cannot close unknown session {}", sessionId);
            return Optional.empty();
        }

        ChargeSession session = found.get();
        if (!session.isOpen()) {
            log.info("Session {} already closed, returning stored values", sessionId);
            return Optional.of(toResult(session, true));
        }

        double meterStartWh = eventRepository.findFirstBySessionIdAndMeterValueIsNotNullOrderBySampledAtAscIdAsc(sessionId)
                .map(ChargePointEvent::getMeterValue)
                .orElse(0.0);
        long durationSeconds = Math.max(0, Duration.between(session.getStartedAt(), endTime).getSeconds());
        double energyKwh = Math.max(0.0, (meterStopWh - meterStartWh) / 1000.0);

        BigDecimal cost = null;
        if (session.getTariffId() != null && energyKwh > 0) {
            TariffQuote quote = tariffService.quote(session.getTariffId(), energyKwh, session.getStartedAt(), endTime);
            cost = quote.getAmount();
            log.info("Session {} priced at {}: {}", sessionId, cost, quote.getBreakdown());
        }

        session.applyStop(SessionStopUpdate.builder()
                .endedAt(endTime)
                .durationSeconds(durationSeconds)
                .energyKwh(energyKwh)
                .stopReason(reason)
                .cost(cost != null ? cost : BigDecimal.ZERO.setScale(2))
                .build());
        sessionRepository.save(session);

        log.info("Closed session {}: duration={}s, energy={} kWh, cost={}, reason={}",
                sessionId, durationSeconds, energyKwh, session.getCost(), reason);
        return Optional.of(toResult(session, false));
    }

    /**
     * Energy from the first to the last energy sample in kWh, never negative
     */
    @Transactional(readOnly = true)
    public double energyFor(Long sessionId) {
        List<ChargePointEvent> samples =
                eventRepository.findBySessionIdAndMeterValueIsNotNullOrderBySampledAtAscIdAsc(sessionId);
        if (samples.isEmpty()) {
            return 0.0;
        }
        double first = samples.get(0).getMeterValue();
        double last = samples.get(samples.size() - 1).getMeterValue();
        return Math.max(0.0, (last - first) / 1000.0);
    }

    /**
     * Energy samples of a session in append order
     */
    @Transactional(readOnly = true)
    public List<TimelinePoint> timeline(Long sessionId) {
        return eventRepository.findBySessionIdAndMeterValueIsNotNullOrderBySampledAtAscIdAsc(sessionId).stream()
                .map(event -> TimelinePoint.builder()
                        .timestamp(event.getSampledAt())
                        .meterValue(event.getMeterValue())
                        .currentAmps(event.getCurrentAmps())
                        .voltage(event.getVoltage())
                        .build())
                .toList();
    }

    /**
     * Highest current x voltage in kW; 0 when no reading pairs up. A charger reports current
     * and voltage as separate sampled values of one MeterValue, so readings are paired by
     * sample time.
     */
    @Transactional(readOnly = true)
    public double maxPower(Long sessionId) {
        Map<Instant, Double> currentAt = new LinkedHashMap<>();
        Map<Instant, Double> voltageAt = new LinkedHashMap<>();
        for (ChargePointEvent event : eventRepository.findElectricalSamples(sessionId)) {
            if (event.getCurrentAmps() != null) {
                currentAt.merge(event.getSampledAt(), event.getCurrentAmps(), Math::max);
            }
            if (event.getVoltage() != null) {
                voltageAt.merge(event.getSampledAt(), event.getVoltage(), Math::max);
            }
        }

        return currentAt.entrySet().stream()
                .filter(entry -> voltageAt.containsKey(entry.getKey()))
                .mapToDouble(entry -> entry.getValue() * voltageAt.get(entry.getKey()) / 1000.0)
                .max()
                .orElse(0.0);
    }

    private void updateRunningEnergy(Long sessionId, double energyWh) {
        sessionRepository.findById(sessionId)
                .filter(ChargeSession::isOpen)
                .ifPresent(session -> {
                    double baseline = eventRepository
                            .findFirstBySessionIdAndMeterValueIsNotNullOrderBySampledAtAscIdAsc(sessionId)
                            .map(ChargePointEvent::getMeterValue)
                            .orElse(energyWh);
                    session.setEnergyKwh(Math.max(0.0, (energyWh - baseline) / 1000.0));
                    sessionRepository.save(session);
                });
    }

    private SessionCloseResult toResult(ChargeSession session, boolean alreadyClosed) {
        return SessionCloseResult.builder()
                .sessionId(session.getId())
                .connectorId(session.getConnectorId())
                .durationSeconds(session.getDurationSeconds() != null ? session.getDurationSeconds() : 0L)
                .energyKwh(session.getEnergyKwh() != null ? session.getEnergyKwh() : 0.0)
                .cost(session.getCost())
                .alreadyClosed(alreadyClosed)
                .build();
    }
}
