package com.wpanther.ocppcentral.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ChargePointNotConnectedException extends OcppCommandException {

    public ChargePointNotConnectedException(String identity) {
        super(identity, "Charge point is not connected: " + identity);
    }
}
