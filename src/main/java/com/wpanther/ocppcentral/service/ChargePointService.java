package com.wpanther.ocppcentral.service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.wpanther.ocppcentral.dto.ocpp.BootNotificationRequest;
import com.wpanther.ocppcentral.entity.ChargePoint;
import com.wpanther.ocppcentral.entity.Connector;
import com.wpanther.ocppcentral.ocpp.ChargePointContext;
import com.wpanther.ocppcentral.ocpp.HandshakeResult;
import com.wpanther.ocppcentral.repository.ChargePointRepository;
import com.wpanther.ocppcentral.repository.ConnectorRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Charger and connector records: identity lookup, boot data, liveness and connector status
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChargePointService {

    private final ChargePointRepository chargePointRepository;
    private final ConnectorRepository connectorRepository;

    /**
     * Find a charger by OCPP identity, falling back to a case-insensitive match
     */
    @Transactional(readOnly = true)
    public Optional<ChargePoint> findByIdentity(String identity) {
        Optional<ChargePoint> exact = chargePointRepository.findByName(identity);
        if (exact.isPresent()) {
            return exact;
        }
        Optional<ChargePoint> relaxed = chargePointRepository.findFirstByNameIgnoreCase(identity);
        relaxed.ifPresent(cp -> log.info("Matched charge point {} case-insensitively as {}", identity, cp.getName()));
        return relaxed;
    }

    /**
     * Decide whether a connecting charger may proceed past the handshake
     */
    public HandshakeResult verify(String identity) {
        Optional<ChargePoint> chargePoint;
        try {
            chargePoint = findByIdentity(identity);
        } catch (DataAccessException e) {
            log.error("Failed to verify charge point {}", identity, e);
            return HandshakeResult.verificationFailed();
        }

        if (chargePoint.isEmpty()) {
            return HandshakeResult.unknownCharger();
        }
        ChargePoint cp = chargePoint.get();
        if (!cp.isEnabled()) {
            return HandshakeResult.chargerDisabled();
        }
        return HandshakeResult.accepted(
                new ChargePointContext(cp.getName(), cp.getId(), cp.getCompanyId(), cp.getSiteId()));
    }

    /**
     * Store the vendor data reported in BootNotification and mark the charger online
     */
    @Transactional
    public void recordBoot(Long chargerId, BootNotificationRequest request) {
        chargePointRepository.findById(chargerId).ifPresentOrElse(cp -> {
            Instant now = Instant.now();
            cp.setBrand(request.getChargePointVendor());
            cp.setModel(request.getChargePointModel());
            cp.setSerialNumber(request.getChargePointSerialNumber());
            cp.setFirmwareVersion(request.getFirmwareVersion());
            if (request.getMeterType() != null) {
                cp.setMeterType(request.getMeterType());
            }
            if (request.getMeterSerialNumber() != null) {
                cp.setMeterSerialNumber(request.getMeterSerialNumber());
            }
            cp.setOnline(true);
            cp.setLastConnectAt(now);
            cp.setUpdatedAt(now);
            chargePointRepository.save(cp);
            log.info("Boot data stored for {}: vendor={}, model={}, firmware={}",
                    cp.getName(), cp.getBrand(), cp.getModel(), cp.getFirmwareVersion());
        }, () -> log.warn("BootNotification for unknown charger id {}", chargerId));
    }

    @Transactional
    public void recordHeartbeat(Long chargerId, Instant when) {
        chargePointRepository.findById(chargerId).ifPresent(cp -> {
            cp.setLastHeartbeatAt(when);
            cp.setOnline(true);
            chargePointRepository.save(cp);
        });
    }

    @Transactional
    public void markOnline(Long chargerId) {
        chargePointRepository.findById(chargerId).ifPresent(cp -> {
            Instant now = Instant.now();
            cp.setOnline(true);
            cp.setLastConnectAt(now);
            cp.setUpdatedAt(now);
            chargePointRepository.save(cp);
        });
    }

    @Transactional
    public void markOffline(Long chargerId) {
        chargePointRepository.findById(chargerId).ifPresent(cp -> {
            Instant now = Instant.now();
            cp.setOnline(false);
            cp.setLastDisconnectAt(now);
            cp.setUpdatedAt(now);
            chargePointRepository.save(cp);
        });
    }

    /**
     * Create or update a connector's status. Connector 0 is the charger itself and is not stored.
     */
    @Transactional
    public void updateConnectorStatus(ChargePointContext context, int connectorId, String status, String errorCode) {
        if (connectorId == 0) {
            return;
        }
        Instant now = Instant.now();
        Connector connector = connectorRepository
                .findByChargerIdAndConnectorId(context.getChargerId(), connectorId)
                .orElseGet(() -> {
                    log.info("Creating connector {} for {}", connectorId, context.getIdentity());
                    return Connector.builder()
                            .chargerId(context.getChargerId())
                            .connectorId(connectorId)
                            .companyId(context.getCompanyId())
                            .siteId(context.getSiteId())
                            .enabled(true)
                            .createdAt(now)
                            .build();
                });
        connector.setStatus(status);
        if (errorCode != null) {
            connector.setErrorCode(errorCode);
        }
        connector.setUpdatedAt(now);
        connectorRepository.save(connector);
        log.debug("Connector {}/{} is now {}", context.getIdentity(), connectorId, status);
    }

    @Transactional(readOnly = true)
    public List<Connector> findConnectors(Long chargerId) {
        return connectorRepository.findByChargerIdOrderByConnectorIdAsc(chargerId);
    }
}
