package com.wpanther.ocppcentral.ocpp;

import com.wpanther.ocppcentral.dto.DriverBilling;
import com.wpanther.ocppcentral.dto.MeterSample;
import com.wpanther.ocppcentral.dto.SessionCloseResult;
import com.wpanther.ocppcentral.dto.ocpp.AuthorizationStatus;
import com.wpanther.ocppcentral.dto.ocpp.AuthorizeRequest;
import com.wpanther.ocppcentral.dto.ocpp.AuthorizeResponse;
import com.wpanther.ocppcentral.dto.ocpp.BootNotificationRequest;
import com.wpanther.ocppcentral.dto.ocpp.BootNotificationResponse;
import com.wpanther.ocppcentral.dto.ocpp.HeartbeatRequest;
import com.wpanther.ocppcentral.dto.ocpp.MeterValue;
import com.wpanther.ocppcentral.dto.ocpp.MeterValuesRequest;
import com.wpanther.ocppcentral.dto.ocpp.RegistrationStatus;
import com.wpanther.ocppcentral.dto.ocpp.SampledValue;
import com.wpanther.ocppcentral.dto.ocpp.StartTransactionRequest;
import com.wpanther.ocppcentral.dto.ocpp.StartTransactionResponse;
import com.wpanther.ocppcentral.dto.ocpp.StatusNotificationRequest;
import com.wpanther.ocppcentral.dto.ocpp.StopTransactionRequest;
import com.wpanther.ocppcentral.dto.ocpp.StopTransactionResponse;
import com.wpanther.ocppcentral.entity.ChargeSession;
import com.wpanther.ocppcentral.entity.Connector;
import com.wpanther.ocppcentral.service.AuthorizationService;
import com.wpanther.ocppcentral.service.ChargePointService;
import com.wpanther.ocppcentral.service.ChargeSessionService;
import com.wpanther.ocppcentral.service.EventLogService;
import com.wpanther.ocppcentral.service.PaymentSyncService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ChargePointRequestHandler
 */
@ExtendWith(MockitoExtension.class)
class ChargePointRequestHandlerTest {

    @Mock
    private ChargePointService chargePointService;

    @Mock
    private AuthorizationService authorizationService;

    @Mock
    private ChargeSessionService chargeSessionService;

    @Mock
    private EventLogService eventLogService;

    @Mock
    private PaymentSyncService paymentSyncService;

    @Mock
    private ChargePointSession session;

    @InjectMocks
    private ChargePointRequestHandler handler;

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant END = Instant.parse("2024-03-01T11:00:00Z");

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(handler, "heartbeatIntervalSeconds", 300);
        lenient().when(session.getContext()).thenReturn(OcppTestSupport.CP1);
        lenient().when(session.getIdentity()).thenReturn("CP-1");
    }

    @Test
    void testOnBootNotification_AcceptedWithInterval() {
        // Arrange
        BootNotificationRequest request = BootNotificationRequest.builder()
                .chargePointVendor("VendorX").chargePointModel("M1").firmwareVersion("1.2.3").build();

        // Act
        BootNotificationResponse response = handler.onBootNotification(session, request);

        // Assert
        assertThat(response.getStatus()).isEqualTo(RegistrationStatus.ACCEPTED);
        assertThat(response.getInterval()).isEqualTo(300);
        assertThat(response.getCurrentTime()).isNotNull();
        verify(chargePointService).recordBoot(1L, request);
    }

    @Test
    void testOnHeartbeat_StorageFailureStillAnswers() {
        // Arrange
        doThrow(new IllegalStateException("db down")).when(chargePointService).recordHeartbeat(eq(1L), any());

        // Act / Assert
        assertThat(handler.onHeartbeat(session, new HeartbeatRequest()).getCurrentTime()).isNotNull();
        verify(session).markHeartbeat(any(Instant.class));
    }

    @Test
    void testOnStatusNotification_ConnectorZeroNotStoredAsConnector() {
        StatusNotificationRequest request = StatusNotificationRequest.builder()
                .connectorId(0).status("Available").errorCode("NoError").build();

        handler.onStatusNotification(session, request);

        verify(chargePointService, never()).updateConnectorStatus(any(), eq(0), any(), any());
        verify(eventLogService).recordEvent(eq(OcppTestSupport.CP1), eq("StatusNotification"), eq(0),
                isNull(), any(), eq(request));
    }

    @Test
    void testOnStatusNotification_UpdatesConnector() {
        StatusNotificationRequest request = StatusNotificationRequest.builder()
                .connectorId(2).status("Faulted").errorCode("GroundFailure").build();

        handler.onStatusNotification(session, request);

        verify(chargePointService).updateConnectorStatus(OcppTestSupport.CP1, 2, "Faulted", "GroundFailure");
    }

    @Test
    void testOnAuthorize_ReturnsDecision() {
        when(authorizationService.authorize("TAG-1", OcppTestSupport.CP1)).thenReturn(AuthorizationStatus.BLOCKED);

        AuthorizeResponse response = handler.onAuthorize(session, new AuthorizeRequest("TAG-1"));

        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.BLOCKED);
    }

    @Test
    void testOnStartTransaction_OpensSessionAndReturnsId() {
        // Arrange
        StartTransactionRequest request = StartTransactionRequest.builder()
                .connectorId(1).idTag("TAG-1").meterStart(1000).timestamp(START).build();
        ChargeSession opened = ChargeSession.builder().id(42L).connectorId(1).startedAt(START).build();
        when(authorizationService.resolveBilling("TAG-1")).thenReturn(new DriverBilling(5L, 7L));
        when(chargeSessionService.open(OcppTestSupport.CP1, "TAG-1", 1, START, 5L, 7L)).thenReturn(opened);

        // Act
        StartTransactionResponse response = handler.onStartTransaction(session, request);

        // Assert
        assertThat(response.getTransactionId()).isEqualTo(42);
        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ACCEPTED);
        verify(chargePointService).updateConnectorStatus(OcppTestSupport.CP1, 1, Connector.STATUS_CHARGING, null);
        verify(chargeSessionService).recordStart(OcppTestSupport.CP1, opened, 1000.0, request);
    }

    @Test
    void testOnStopTransaction_ClosesAndOpensPayment() {
        // Arrange
        MeterValue transactionData = MeterValue.builder()
                .timestamp(END)
                .sampledValue(List.of(SampledValue.builder().value("16").measurand("Current.Import").build()))
                .build();
        StopTransactionRequest request = StopTransactionRequest.builder()
                .transactionId(42).meterStop(6000).timestamp(END).reason("Local")
                .transactionData(List.of(transactionData)).build();
        SessionCloseResult result = SessionCloseResult.builder()
                .sessionId(42L).connectorId(1).durationSeconds(3600).energyKwh(5.0)
                .cost(new BigDecimal("2.50")).build();
        when(chargeSessionService.close(42L, END, "Local", 6000.0)).thenReturn(Optional.of(result));

        // Act
        StopTransactionResponse response = handler.onStopTransaction(session, request);

        // Assert
        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ACCEPTED);
        verify(chargePointService).updateConnectorStatus(OcppTestSupport.CP1, 1, Connector.STATUS_AVAILABLE, null);
        verify(chargeSessionService).recordStop(OcppTestSupport.CP1, result, END, 6000.0, request);
        verify(chargeSessionService).recordMeterSample(eq(OcppTestSupport.CP1), eq(1), eq(42L), any(MeterSample.class));
        verify(paymentSyncService).onSessionCompleted(42L);
    }

    @Test
    void testOnStopTransaction_RepeatedStopRetriesPaymentOnly() {
        // Arrange
        StopTransactionRequest request = StopTransactionRequest.builder()
                .transactionId(42).meterStop(6000).timestamp(END).build();
        SessionCloseResult result = SessionCloseResult.builder()
                .sessionId(42L).connectorId(1).alreadyClosed(true).build();
        when(chargeSessionService.close(42L, END, null, 6000.0)).thenReturn(Optional.of(result));

        // Act
        StopTransactionResponse response = handler.onStopTransaction(session, request);

        // Assert
        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ACCEPTED);
        verify(chargeSessionService, never()).recordStop(any(), any(), any(), anyDouble(), any());
        verify(chargePointService, never()).updateConnectorStatus(any(), anyInt(), any(), any());
        verify(paymentSyncService).onSessionCompleted(42L);
    }

    @Test
    void testOnStopTransaction_FailedPaymentRetriedOnRepeatedStop() {
        // Arrange
        StopTransactionRequest request = StopTransactionRequest.builder()
                .transactionId(42).meterStop(6000).timestamp(END).build();
        SessionCloseResult first = SessionCloseResult.builder()
                .sessionId(42L).connectorId(1).energyKwh(5.0).alreadyClosed(false).build();
        SessionCloseResult repeated = SessionCloseResult.builder()
                .sessionId(42L).connectorId(1).energyKwh(5.0).alreadyClosed(true).build();
        when(chargeSessionService.close(42L, END, null, 6000.0))
                .thenReturn(Optional.of(first))
                .thenReturn(Optional.of(repeated));
        doThrow(new DataAccessResourceFailureException("db down"))
                .doNothing()
                .when(paymentSyncService).onSessionCompleted(42L);

        // Act
        StopTransactionResponse firstResponse = handler.onStopTransaction(session, request);
        StopTransactionResponse secondResponse = handler.onStopTransaction(session, request);

        // Assert
        assertThat(firstResponse.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ACCEPTED);
        assertThat(secondResponse.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ACCEPTED);
        verify(paymentSyncService, times(2)).onSessionCompleted(42L);
    }

    @Test
    void testOnStopTransaction_UnknownTransactionStillAccepted() {
        StopTransactionRequest request = StopTransactionRequest.builder()
                .transactionId(999).meterStop(6000).timestamp(END).build();
        when(chargeSessionService.close(999L, END, null, 6000.0)).thenReturn(Optional.empty());

        StopTransactionResponse response = handler.onStopTransaction(session, request);

        assertThat(response.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ACCEPTED);
        verify(paymentSyncService, never()).onSessionCompleted(anyLong());
    }

    @Test
    void testOnMeterValues_WithoutTransactionIdUsesOpenSession() {
        // Arrange
        MeterValuesRequest request = MeterValuesRequest.builder()
                .connectorId(1)
                .meterValue(List.of(MeterValue.builder()
                        .timestamp(START.plusSeconds(300))
                        .sampledValue(List.of(
                                SampledValue.builder().value("2500").build(),
                                SampledValue.builder().value("230").measurand("Voltage").build()))
                        .build()))
                .build();
        when(chargeSessionService.findOpenSession(1L, 1))
                .thenReturn(Optional.of(ChargeSession.builder().id(42L).build()));

        // Act
        handler.onMeterValues(session, request);

        // Assert
        ArgumentCaptor<MeterSample> samples = ArgumentCaptor.forClass(MeterSample.class);
        verify(chargeSessionService, times(2))
                .recordMeterSample(eq(OcppTestSupport.CP1), eq(1), eq(42L), samples.capture());
        assertThat(samples.getAllValues().get(0).getEnergyWh()).isEqualTo(2500.0);
        assertThat(samples.getAllValues().get(1).getVoltage()).isEqualTo(230.0);
    }

    @Test
    void testFallbacks() {
        assertThat(handler.authorizeFallback().getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ACCEPTED);
        assertThat(handler.startTransactionFallback().getTransactionId()).isZero();
        assertThat(handler.startTransactionFallback().getIdTagInfo().getStatus())
                .isEqualTo(AuthorizationStatus.INVALID);
        assertThat(handler.stopTransactionFallback().getIdTagInfo().getStatus())
                .isEqualTo(AuthorizationStatus.ACCEPTED);
    }
}
