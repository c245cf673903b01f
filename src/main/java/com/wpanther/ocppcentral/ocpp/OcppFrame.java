package com.wpanther.ocppcentral.ocpp;

/**
 * Decoded OCPP-J message: {@code [messageTypeId, uniqueId, ...]}.
 */
public abstract class OcppFrame {

    public static final int CALL = 2;
    public static final int CALL_RESULT = 3;
    public static final int CALL_ERROR = 4;

    private final String uniqueId;

    protected OcppFrame(String uniqueId) {
        this.uniqueId = uniqueId;
    }

    public String getUniqueId() {
        return uniqueId;
    }

    public abstract int getMessageTypeId();
}
