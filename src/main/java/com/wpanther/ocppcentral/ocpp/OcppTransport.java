package com.wpanther.ocppcentral.ocpp;

import java.io.IOException;

/**
 * Text channel to one charger.
 */
public interface OcppTransport {

    String getId();

    boolean isOpen();

    void send(String text) throws IOException;

    /**
     * Close the channel with a WebSocket close code. Never throws.
     */
    void close(int code, String reason);
}
