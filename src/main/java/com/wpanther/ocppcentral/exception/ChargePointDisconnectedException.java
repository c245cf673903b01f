package com.wpanther.ocppcentral.exception;

/**
 * The connection closed before the charger answered.
 */
public class ChargePointDisconnectedException extends OcppCommandException {

    public ChargePointDisconnectedException(String identity) {
        super(identity, "Connection to charge point closed: " + identity);
    }

    public ChargePointDisconnectedException(String identity, Throwable cause) {
        super(identity, "Connection to charge point failed: " + identity, cause);
    }
}
