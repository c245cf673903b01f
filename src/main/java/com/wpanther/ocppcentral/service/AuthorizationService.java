package com.wpanther.ocppcentral.service;

import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.wpanther.ocppcentral.dto.DriverBilling;
import com.wpanther.ocppcentral.dto.ocpp.AuthorizationStatus;
import com.wpanther.ocppcentral.entity.ChargerUsePermit;
import com.wpanther.ocppcentral.entity.Driver;
import com.wpanther.ocppcentral.entity.DriverGroup;
import com.wpanther.ocppcentral.entity.RfidCard;
import com.wpanther.ocppcentral.ocpp.ChargePointContext;
import com.wpanther.ocppcentral.repository.ChargerUsePermitRepository;
import com.wpanther.ocppcentral.repository.DriverGroupRepository;
import com.wpanther.ocppcentral.repository.DriverRepository;
import com.wpanther.ocppcentral.repository.RfidCardRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether an idTag may charge at a charger. Always yields a terminal
 * status; persistence failures degrade to {@link AuthorizationStatus#INVALID}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorizationService {

    private final RfidCardRepository rfidCardRepository;
    private final ChargerUsePermitRepository permitRepository;
    private final DriverRepository driverRepository;
    private final DriverGroupRepository driverGroupRepository;

    public AuthorizationStatus authorize(String idTag, ChargePointContext context) {
        Optional<RfidCard> card;
        try {
            card = rfidCardRepository.findById(idTag);
        } catch (DataAccessException e) {
            log.error("RFID lookup failed for {} at {}", idTag, context.getIdentity(), e);
            return AuthorizationStatus.INVALID;
        }

        if (card.isEmpty()) {
            log.info("Unknown idTag {} at {}", idTag, context.getIdentity());
            return AuthorizationStatus.INVALID;
        }
        if (!card.get().isEnabled()) {
            log.info("Disabled idTag {} at {}", idTag, context.getIdentity());
            return AuthorizationStatus.BLOCKED;
        }

        Long driverId = card.get().getDriverId();
        if (driverId != null) {
            Optional<ChargerUsePermit> permit;
            try {
                permit = permitRepository.findFirstByCompanyIdAndSiteIdAndDriverId(
                        context.getCompanyId(), context.getSiteId(), driverId);
            } catch (DataAccessException e) {
                log.error("Permit lookup failed for driver {} at {}", driverId, context.getIdentity(), e);
                return AuthorizationStatus.INVALID;
            }
            if (permit.isPresent() && !permit.get().isEnabled()) {
                log.info("Driver {} is not permitted at site {}", driverId, context.getSiteId());
                return AuthorizationStatus.BLOCKED;
            }
        }

        log.info("idTag {} accepted at {}", idTag, context.getIdentity());
        return AuthorizationStatus.ACCEPTED;
    }

    /**
     * Resolve the driver owning an idTag and the tariff of the driver's group.
     * Disabled drivers and groups contribute nothing. Never throws.
     */
    public DriverBilling resolveBilling(String idTag) {
        try {
            Optional<Long> driverId = rfidCardRepository.findById(idTag)
                    .map(RfidCard::getDriverId);
            if (driverId.isEmpty()) {
                return DriverBilling.NONE;
            }

            Optional<Driver> driver = driverRepository.findById(driverId.get())
                    .filter(Driver::isEnabled);
            if (driver.isEmpty()) {
                return DriverBilling.NONE;
            }

            Long tariffId = Optional.ofNullable(driver.get().getGroupId())
                    .flatMap(driverGroupRepository::findById)
                    .filter(DriverGroup::isEnabled)
                    .map(DriverGroup::getTariffId)
                    .orElse(null);
            return new DriverBilling(driver.get().getId(), tariffId);
        } catch (DataAccessException e) {
            log.error("Failed to resolve driver and tariff for idTag {}", idTag, e);
            return DriverBilling.NONE;
        }
    }
}
