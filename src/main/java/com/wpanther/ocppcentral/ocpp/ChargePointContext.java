package com.wpanther.ocppcentral.ocpp;

import lombok.Value;

/**
 * Who a connection belongs to, resolved once during the handshake.
 */
@Value
public class ChargePointContext {

    String identity;
    Long chargerId;
    Long companyId;
    Long siteId;
}
