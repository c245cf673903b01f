package com.wpanther.ocppcentral.controller;

import java.util.concurrent.CompletableFuture;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;
import com.wpanther.ocppcentral.dto.ChargePointCommandRequest;
import com.wpanther.ocppcentral.service.ChargePointCommandService;

import lombok.RequiredArgsConstructor;

/**
 * Remote commands. Responses carry the charger's confirmation payload once it arrives.
 */
@RestController
@RequestMapping("/api/v1/charge-points/{identity}/commands")
@RequiredArgsConstructor
public class ChargePointCommandController {

    private final ChargePointCommandService commandService;

    @PostMapping("/reset")
    public CompletableFuture<ResponseEntity<JsonNode>> reset(@PathVariable String identity,
                                                            @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.reset(identity, request.getType()));
    }

    @PostMapping("/unlock-connector")
    public CompletableFuture<ResponseEntity<JsonNode>> unlockConnector(@PathVariable String identity,
                                                                      @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.unlockConnector(identity, request.getConnectorId()));
    }

    @PostMapping("/change-availability")
    public CompletableFuture<ResponseEntity<JsonNode>> changeAvailability(@PathVariable String identity,
                                                                         @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.changeAvailability(identity, request.getConnectorId(), request.getType()));
    }

    @PostMapping("/change-configuration")
    public CompletableFuture<ResponseEntity<JsonNode>> changeConfiguration(@PathVariable String identity,
                                                                          @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.changeConfiguration(identity, request.getKey(), request.getValue()));
    }

    @PostMapping("/get-configuration")
    public CompletableFuture<ResponseEntity<JsonNode>> getConfiguration(@PathVariable String identity,
                                                                       @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.getConfiguration(identity, request.getKeys()));
    }

    @PostMapping("/remote-start")
    public CompletableFuture<ResponseEntity<JsonNode>> remoteStart(@PathVariable String identity,
                                                                  @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.remoteStartTransaction(identity, request.getIdTag(), request.getConnectorId(),
                request.getChargingProfile()));
    }

    @PostMapping("/remote-stop")
    public CompletableFuture<ResponseEntity<JsonNode>> remoteStop(@PathVariable String identity,
                                                                 @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.remoteStopTransaction(identity, request.getTransactionId()));
    }

    @PostMapping("/set-charging-profile")
    public CompletableFuture<ResponseEntity<JsonNode>> setChargingProfile(@PathVariable String identity,
                                                                         @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.setChargingProfile(identity, request.getConnectorId(), request.getChargingProfile()));
    }

    @PostMapping("/reserve-now")
    public CompletableFuture<ResponseEntity<JsonNode>> reserveNow(@PathVariable String identity,
                                                                 @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.reserveNow(identity, request.getConnectorId(), request.getExpiryDate(),
                request.getIdTag(), request.getReservationId(), request.getParentIdTag()));
    }

    @PostMapping("/cancel-reservation")
    public CompletableFuture<ResponseEntity<JsonNode>> cancelReservation(@PathVariable String identity,
                                                                        @RequestBody ChargePointCommandRequest request) {
        return ok(commandService.cancelReservation(identity, request.getReservationId()));
    }

    private CompletableFuture<ResponseEntity<JsonNode>> ok(CompletableFuture<JsonNode> confirmation) {
        return confirmation.thenApply(ResponseEntity::ok);
    }
}
