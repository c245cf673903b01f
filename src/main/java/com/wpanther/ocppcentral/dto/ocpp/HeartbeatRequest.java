package com.wpanther.ocppcentral.dto.ocpp;

import lombok.Data;

/**
 * Heartbeat.req has no fields.
 */
@Data
public class HeartbeatRequest {
}
