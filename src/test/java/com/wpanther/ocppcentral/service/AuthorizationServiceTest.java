package com.wpanther.ocppcentral.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

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

/**
 * Unit tests for AuthorizationService
 */
@ExtendWith(MockitoExtension.class)
class AuthorizationServiceTest {

    @Mock
    private RfidCardRepository rfidCardRepository;

    @Mock
    private ChargerUsePermitRepository permitRepository;

    @Mock
    private DriverRepository driverRepository;

    @Mock
    private DriverGroupRepository driverGroupRepository;

    @InjectMocks
    private AuthorizationService authorizationService;

    private final ChargePointContext context = new ChargePointContext("CP-1", 1L, 10L, 100L);

    private RfidCard card(boolean enabled, Long driverId) {
        return RfidCard.builder().id("TAG-1").companyId(10L).driverId(driverId).enabled(enabled).build();
    }

    @Test
    void testAuthorize_UnknownTagIsInvalid() {
        when(rfidCardRepository.findById("TAG-1")).thenReturn(Optional.empty());

        assertThat(authorizationService.authorize("TAG-1", context)).isEqualTo(AuthorizationStatus.INVALID);
    }

    @Test
    void testAuthorize_DisabledCardIsBlocked() {
        when(rfidCardRepository.findById("TAG-1")).thenReturn(Optional.of(card(false, 5L)));

        assertThat(authorizationService.authorize("TAG-1", context)).isEqualTo(AuthorizationStatus.BLOCKED);
        verifyNoInteractions(permitRepository);
    }

    @Test
    void testAuthorize_DisabledPermitIsBlocked() {
        // Arrange
        when(rfidCardRepository.findById("TAG-1")).thenReturn(Optional.of(card(true, 5L)));
        when(permitRepository.findFirstByCompanyIdAndSiteIdAndDriverId(10L, 100L, 5L))
                .thenReturn(Optional.of(ChargerUsePermit.builder().driverId(5L).enabled(false).build()));

        // Act
        AuthorizationStatus status = authorizationService.authorize("TAG-1", context);

        // Assert
        assertThat(status).isEqualTo(AuthorizationStatus.BLOCKED);
    }

    @Test
    void testAuthorize_NoPermitRecordIsAccepted() {
        when(rfidCardRepository.findById("TAG-1")).thenReturn(Optional.of(card(true, 5L)));
        when(permitRepository.findFirstByCompanyIdAndSiteIdAndDriverId(10L, 100L, 5L))
                .thenReturn(Optional.empty());

        assertThat(authorizationService.authorize("TAG-1", context)).isEqualTo(AuthorizationStatus.ACCEPTED);
    }

    @Test
    void testAuthorize_CardWithoutDriverIsAccepted() {
        when(rfidCardRepository.findById("TAG-1")).thenReturn(Optional.of(card(true, null)));

        assertThat(authorizationService.authorize("TAG-1", context)).isEqualTo(AuthorizationStatus.ACCEPTED);
        verifyNoInteractions(permitRepository);
    }

    @Test
    void testAuthorize_StorageFailureIsInvalid() {
        when(rfidCardRepository.findById("TAG-1")).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(authorizationService.authorize("TAG-1", context)).isEqualTo(AuthorizationStatus.INVALID);
    }

    @Test
    void testResolveBilling_DriverGroupTariff() {
        // Arrange
        when(rfidCardRepository.findById("TAG-1")).thenReturn(Optional.of(card(true, 5L)));
        when(driverRepository.findById(5L))
                .thenReturn(Optional.of(Driver.builder().id(5L).groupId(3L).enabled(true).build()));
        when(driverGroupRepository.findById(3L))
                .thenReturn(Optional.of(DriverGroup.builder().id(3L).tariffId(7L).enabled(true).build()));

        // Act
        DriverBilling billing = authorizationService.resolveBilling("TAG-1");

        // Assert
        assertThat(billing.getDriverId()).isEqualTo(5L);
        assertThat(billing.getTariffId()).isEqualTo(7L);
    }

    @Test
    void testResolveBilling_DisabledGroupHasNoTariff() {
        when(rfidCardRepository.findById("TAG-1")).thenReturn(Optional.of(card(true, 5L)));
        when(driverRepository.findById(5L))
                .thenReturn(Optional.of(Driver.builder().id(5L).groupId(3L).enabled(true).build()));
        when(driverGroupRepository.findById(3L))
                .thenReturn(Optional.of(DriverGroup.builder().id(3L).tariffId(7L).enabled(false).build()));

        DriverBilling billing = authorizationService.resolveBilling("TAG-1");

        assertThat(billing.getDriverId()).isEqualTo(5L);
        assertThat(billing.getTariffId()).isNull();
    }

    @Test
    void testResolveBilling_DisabledDriverResolvesNothing() {
        when(rfidCardRepository.findById("TAG-1")).thenReturn(Optional.of(card(true, 5L)));
        when(driverRepository.findById(5L))
                .thenReturn(Optional.of(Driver.builder().id(5L).groupId(3L).enabled(false).build()));

        assertThat(authorizationService.resolveBilling("TAG-1")).isEqualTo(DriverBilling.NONE);
        verifyNoInteractions(driverGroupRepository);
    }

    @Test
    void testResolveBilling_StorageFailureResolvesNothing() {
        when(rfidCardRepository.findById("TAG-1")).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(authorizationService.resolveBilling("TAG-1")).isEqualTo(DriverBilling.NONE);
    }
}
