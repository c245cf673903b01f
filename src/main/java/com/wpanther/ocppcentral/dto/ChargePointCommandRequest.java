package com.wpanther.ocppcentral.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Body of the outbound command endpoints. Each command reads the fields it needs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargePointCommandRequest {

    private String type;
    private Integer connectorId;
    private String key;
    private String value;
    private List<String> keys;
    private String idTag;
    private String parentIdTag;
    private Integer transactionId;
    private Integer reservationId;
    private Instant expiryDate;
    private JsonNode chargingProfile;
}
