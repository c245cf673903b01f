package com.wpanther.ocppcentral.ocpp;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every OCPP 1.6 action, with the direction(s) it may travel.
 */
public enum OcppAction {

    // Charge point to central system
    AUTHORIZE("Authorize", true, false),
    BOOT_NOTIFICATION("BootNotification", true, false),
    DIAGNOSTICS_STATUS_NOTIFICATION("DiagnosticsStatusNotification", true, false),
    FIRMWARE_STATUS_NOTIFICATION("FirmwareStatusNotification", true, false),
    HEARTBEAT("Heartbeat", true, false),
    METER_VALUES("MeterValues", true, false),
    START_TRANSACTION("StartTransaction", true, false),
    STATUS_NOTIFICATION("StatusNotification", true, false),
    STOP_TRANSACTION("StopTransaction", true, false),

    // Both directions
    DATA_TRANSFER("DataTransfer", true, true),

    // Central system to charge point
    CANCEL_RESERVATION("CancelReservation", false, true),
    CHANGE_AVAILABILITY("ChangeAvailability", false, true),
    CHANGE_CONFIGURATION("ChangeConfiguration", false, true),
    CLEAR_CACHE("ClearCache", false, true),
    CLEAR_CHARGING_PROFILE("ClearChargingProfile", false, true),
    GET_COMPOSITE_SCHEDULE("GetCompositeSchedule", false, true),
    GET_CONFIGURATION("GetConfiguration", false, true),
    GET_DIAGNOSTICS("GetDiagnostics", false, true),
    GET_LOCAL_LIST_VERSION("GetLocalListVersion", false, true),
    REMOTE_START_TRANSACTION("RemoteStartTransaction", false, true),
    REMOTE_STOP_TRANSACTION("RemoteStopTransaction", false, true),
    RESERVE_NOW("ReserveNow", false, true),
    RESET("Reset", false, true),
    SEND_LOCAL_LIST("SendLocalList", false, true),
    SET_CHARGING_PROFILE("SetChargingProfile", false, true),
    TRIGGER_MESSAGE("TriggerMessage", false, true),
    UNLOCK_CONNECTOR("UnlockConnector", false, true),
    UPDATE_FIRMWARE("UpdateFirmware", false, true);

    private static final Map<String, OcppAction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(OcppAction::getActionName, Function.identity()));

    private final String actionName;
    private final boolean inbound;
    private final boolean outbound;

    OcppAction(String actionName, boolean inbound, boolean outbound) {
        this.actionName = actionName;
        this.inbound = inbound;
        this.outbound = outbound;
    }

    /**
     * Exact, case-sensitive lookup by wire name
     */
    public static Optional<OcppAction> fromActionName(String actionName) {
        return Optional.ofNullable(BY_NAME.get(actionName));
    }

    public String getActionName() {
        return actionName;
    }

    /** Sent by the charge point. */
    public boolean isInbound() {
        return inbound;
    }

    /** Sent by the central system. */
    public boolean isOutbound() {
        return outbound;
    }
}
