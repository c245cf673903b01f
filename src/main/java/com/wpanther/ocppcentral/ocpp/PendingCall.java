package com.wpanther.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound call waiting for the charger's CallResult or CallError.
 */
@Getter
@RequiredArgsConstructor
class PendingCall {

    private final String uniqueId;
    private final OcppAction action;
    private final CompletableFuture<JsonNode> future;
    private final Instant sentAt;
}
