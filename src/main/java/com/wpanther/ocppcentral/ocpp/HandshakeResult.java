package com.wpanther.ocppcentral.ocpp;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of verifying a connecting charger. Rejections carry the
 * application close code sent to the charger.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HandshakeResult {

    public static final int CLOSE_NOT_REGISTERED = 4001;
    public static final int CLOSE_DISABLED = 4002;
    public static final int CLOSE_INTERNAL_ERROR = 4003;

    public enum Outcome {
        ACCEPTED,
        UNKNOWN_CHARGER,
        CHARGER_DISABLED,
        VERIFICATION_FAILED
    }

    private final Outcome outcome;
    private final ChargePointContext context;
    private final int closeCode;
    private final String closeReason;

    public static HandshakeResult accepted(ChargePointContext context) {
        return new HandshakeResult(Outcome.ACCEPTED, context, 0, null);
    }

    public static HandshakeResult unknownCharger() {
        return new HandshakeResult(Outcome.UNKNOWN_CHARGER, null, CLOSE_NOT_REGISTERED,
                "Charger not registered in system");
    }

    public static HandshakeResult chargerDisabled() {
        return new HandshakeResult(Outcome.CHARGER_DISABLED, null, CLOSE_DISABLED, "Charger is disabled");
    }

    public static HandshakeResult verificationFailed() {
        return new HandshakeResult(Outcome.VERIFICATION_FAILED, null, CLOSE_INTERNAL_ERROR, "Internal server error");
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
