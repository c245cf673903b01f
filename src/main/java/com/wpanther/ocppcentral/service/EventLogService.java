package com.wpanther.ocppcentral.service;

import java.time.Instant;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.ocppcentral.dto.MeterSample;
import com.wpanther.ocppcentral.entity.ChargePointEvent;
import com.wpanther.ocppcentral.ocpp.ChargePointContext;
import com.wpanther.ocppcentral.repository.ChargePointEventRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only event trail of charger activity
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventLogService {

    private final ChargePointEventRepository eventRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record a non-metering event such as Authorize or StatusNotification
     */
    @Transactional
    public ChargePointEvent recordEvent(ChargePointContext context, String eventType, Integer connectorId,
                                        Long sessionId, Instant timestamp, Object payload) {
        ChargePointEvent event = createBaseEvent(context, eventType, connectorId, sessionId, timestamp, payload);
        ChargePointEvent saved = eventRepository.save(event);
        log.debug("Logged {} event for {} (session={})", eventType, context.getIdentity(), sessionId);
        return saved;
    }

    /**
     * Record a transaction boundary carrying the energy register in Wh
     */
    @Transactional
    public ChargePointEvent recordTransactionEvent(ChargePointContext context, String eventType, Integer connectorId,
                                                   Long sessionId, Instant timestamp, double meterWh, Object payload) {
        ChargePointEvent event = createBaseEvent(context, eventType, connectorId, sessionId, timestamp, payload);
        event.setMeterValue(meterWh);
        ChargePointEvent saved = eventRepository.save(event);
        log.info("Logged {} for {} (session={}, meter={} Wh)", eventType, context.getIdentity(), sessionId, meterWh);
        return saved;
    }

    /**
     * Append one meter sample
     */
    @Transactional
    public ChargePointEvent recordMeterSample(ChargePointContext context, Integer connectorId, Long sessionId,
                                              MeterSample sample) {
        ChargePointEvent event = createBaseEvent(context, ChargePointEvent.TYPE_METER_VALUES, connectorId, sessionId,
                sample.getTimestamp(), sample.getRawData());
        event.setMeterValue(sample.getEnergyWh());
        event.setCurrentAmps(sample.getCurrentAmps());
        event.setVoltage(sample.getVoltage());
        event.setTemperature(sample.getTemperature());
        return eventRepository.save(event);
    }

    private ChargePointEvent createBaseEvent(ChargePointContext context, String eventType, Integer connectorId,
                                             Long sessionId, Instant timestamp, Object payload) {
        Instant now = Instant.now();
        return ChargePointEvent.builder()
                .companyId(context.getCompanyId())
                .siteId(context.getSiteId())
                .chargerId(context.getChargerId())
                .connectorId(connectorId)
                .sessionId(sessionId)
                .sampledAt(timestamp != null ? timestamp : now)
                .eventType(eventType)
                .origin(ChargePointEvent.ORIGIN_CHARGE_POINT)
                .payload(toJson(payload))
                .createdAt(now)
                .build();
    }

    private String toJson(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize event payload, storing text form", e);
            return String.valueOf(payload);
        }
    }
}
