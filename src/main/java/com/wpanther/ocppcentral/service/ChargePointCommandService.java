package com.wpanther.ocppcentral.service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wpanther.ocppcentral.exception.ChargePointNotConnectedException;
import com.wpanther.ocppcentral.ocpp.ChargePointSession;
import com.wpanther.ocppcentral.ocpp.ConnectionRegistry;
import com.wpanther.ocppcentral.ocpp.OcppAction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Outbound commands to connected chargers. Each returns the charger's confirmation
 * payload; the future fails on timeout, CallError or disconnect.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChargePointCommandService {

    private final ConnectionRegistry connectionRegistry;

    public CompletableFuture<JsonNode> reset(String identity, String type) {
        requireOneOf("type", type, "Hard", "Soft");
        return send(identity, OcppAction.RESET, payload("type", type));
    }

    public CompletableFuture<JsonNode> unlockConnector(String identity, Integer connectorId) {
        requireNonNull("connectorId", connectorId);
        return send(identity, OcppAction.UNLOCK_CONNECTOR, payload("connectorId", connectorId));
    }

    public CompletableFuture<JsonNode> changeAvailability(String identity, Integer connectorId, String type) {
        requireNonNull("connectorId", connectorId);
        requireOneOf("type", type, "Inoperative", "Operative");
        Map<String, Object> payload = payload("connectorId", connectorId);
        payload.put("type", type);
        return send(identity, OcppAction.CHANGE_AVAILABILITY, payload);
    }

    public CompletableFuture<JsonNode> changeConfiguration(String identity, String key, String value) {
        requireNonNull("key", key);
        requireNonNull("value", value);
        Map<String, Object> payload = payload("key", key);
        payload.put("value", value);
        return send(identity, OcppAction.CHANGE_CONFIGURATION, payload);
    }

    /**
     * @param keys configuration keys to read; null or empty reads all
     */
    public CompletableFuture<JsonNode> getConfiguration(String identity, List<String> keys) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (keys != null && !keys.isEmpty()) {
            payload.put("key", keys);
        }
        return send(identity, OcppAction.GET_CONFIGURATION, payload);
    }

    public CompletableFuture<JsonNode> remoteStartTransaction(String identity, String idTag, Integer connectorId,
                                                             JsonNode chargingProfile) {
        requireNonNull("idTag", idTag);
        Map<String, Object> payload = payload("idTag", idTag);
        if (connectorId != null) {
            payload.put("connectorId", connectorId);
        }
        if (chargingProfile != null && !chargingProfile.isNull()) {
            payload.put("chargingProfile", chargingProfile);
        }
        return send(identity, OcppAction.REMOTE_START_TRANSACTION, payload);
    }

    public CompletableFuture<JsonNode> remoteStopTransaction(String identity, Integer transactionId) {
        requireNonNull("transactionId", transactionId);
        return send(identity, OcppAction.REMOTE_STOP_TRANSACTION, payload("transactionId", transactionId));
    }

    public CompletableFuture<JsonNode> setChargingProfile(String identity, Integer connectorId,
                                                          JsonNode chargingProfile) {
        requireNonNull("connectorId", connectorId);
        requireNonNull("chargingProfile", chargingProfile);
        Map<String, Object> payload = payload("connectorId", connectorId);
        payload.put("csChargingProfiles", chargingProfile);
        return send(identity, OcppAction.SET_CHARGING_PROFILE, payload);
    }

    public CompletableFuture<JsonNode> reserveNow(String identity, Integer connectorId, Instant expiryDate,
                                                  String idTag, Integer reservationId, String parentIdTag) {
        requireNonNull("connectorId", connectorId);
        requireNonNull("expiryDate", expiryDate);
        requireNonNull("idTag", idTag);
        requireNonNull("reservationId", reservationId);
        Map<String, Object> payload = payload("connectorId", connectorId);
        payload.put("expiryDate", expiryDate);
        payload.put("idTag", idTag);
        if (parentIdTag != null) {
            payload.put("parentIdTag", parentIdTag);
        }
        payload.put("reservationId", reservationId);
        return send(identity, OcppAction.RESERVE_NOW, payload);
    }

    public CompletableFuture<JsonNode> cancelReservation(String identity, Integer reservationId) {
        requireNonNull("reservationId", reservationId);
        return send(identity, OcppAction.CANCEL_RESERVATION, payload("reservationId", reservationId));
    }

    private CompletableFuture<JsonNode> send(String identity, OcppAction action, Map<String, Object> payload) {
        ChargePointSession session = connectionRegistry.get(identity)
                .orElseThrow(() -> new ChargePointNotConnectedException(identity));
        log.info("Sending {} to {}: {}", action.getActionName(), identity, payload);
        return session.call(action, payload);
    }

    private static Map<String, Object> payload(String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, value);
        return payload;
    }

    private static void requireNonNull(String field, Object value) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static void requireOneOf(String field, String value, String... allowed) {
        requireNonNull(field, value);
        for (String candidate : allowed) {
            if (candidate.equals(value)) {
                return;
            }
        }
        throw new IllegalArgumentException(field + " must be one of " + String.join(", ", allowed));
    }
}
