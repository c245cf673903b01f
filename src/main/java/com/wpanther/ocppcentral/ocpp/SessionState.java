package com.wpanther.ocppcentral.ocpp;

public enum SessionState {
    HANDSHAKING,
    ACTIVE,
    CLOSING,
    CLOSED
}
