package com.wpanther.ocppcentral.ocpp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.wpanther.ocppcentral.dto.ocpp.AuthorizeRequest;
import com.wpanther.ocppcentral.dto.ocpp.BootNotificationRequest;
import com.wpanther.ocppcentral.dto.ocpp.HeartbeatRequest;
import com.wpanther.ocppcentral.dto.ocpp.MeterValuesRequest;
import com.wpanther.ocppcentral.dto.ocpp.StartTransactionRequest;
import com.wpanther.ocppcentral.dto.ocpp.StatusNotificationRequest;
import com.wpanther.ocppcentral.dto.ocpp.StopTransactionRequest;
import com.wpanther.ocppcentral.exception.OcppProtocolException;
import jakarta.annotation.PostConstruct;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.annotation.Annotation;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Explicit action-to-handler table for inbound calls. Each supported action has a
 * request type, a handler and a fallback response used when the handler fails,
 * so the charger always gets an answer.
 */
@Component
@Slf4j
public class OcppMessageDispatcher {

    private static final Set<Class<? extends Annotation>> REQUIRED_CONSTRAINTS =
            Set.of(NotNull.class, NotBlank.class, NotEmpty.class);

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Map<OcppAction, ActionRoute<?>> routes;

    public OcppMessageDispatcher(ObjectMapper objectMapper, Validator validator,
                                 ChargePointRequestHandler handler) {
        this.objectMapper = objectMapper;
        this.validator = validator;

        Map<OcppAction, ActionRoute<?>> table = new EnumMap<>(OcppAction.class);
        table.put(OcppAction.BOOT_NOTIFICATION, ActionRoute.of(BootNotificationRequest.class,
                handler::onBootNotification, handler::bootNotificationFallback));
        table.put(OcppAction.HEARTBEAT, ActionRoute.of(HeartbeatRequest.class,
                handler::onHeartbeat, handler::heartbeatFallback));
        table.put(OcppAction.STATUS_NOTIFICATION, ActionRoute.of(StatusNotificationRequest.class,
                handler::onStatusNotification, handler::emptyFallback));
        table.put(OcppAction.AUTHORIZE, ActionRoute.of(AuthorizeRequest.class,
                handler::onAuthorize, handler::authorizeFallback));
        table.put(OcppAction.START_TRANSACTION, ActionRoute.of(StartTransactionRequest.class,
                handler::onStartTransaction, handler::startTransactionFallback));
        table.put(OcppAction.STOP_TRANSACTION, ActionRoute.of(StopTransactionRequest.class,
                handler::onStopTransaction, handler::stopTransactionFallback));
        table.put(OcppAction.METER_VALUES, ActionRoute.of(MeterValuesRequest.class,
                handler::onMeterValues, handler::emptyFallback));
        table.put(OcppAction.DATA_TRANSFER, ActionRoute.unsupported());
        table.put(OcppAction.DIAGNOSTICS_STATUS_NOTIFICATION, ActionRoute.unsupported());
        table.put(OcppAction.FIRMWARE_STATUS_NOTIFICATION, ActionRoute.unsupported());
        this.routes = Collections.unmodifiableMap(table);
    }

    /**
     * Every action a charger may send must be either handled or explicitly unsupported.
     */
    @PostConstruct
    public void validateRoutes() {
        Set<OcppAction> missing = Arrays.stream(OcppAction.values())
                .filter(OcppAction::isInbound)
                .filter(action -> !routes.containsKey(action))
                .collect(Collectors.toSet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No route for inbound OCPP actions: " + missing);
        }
        log.info("OCPP dispatch table ready: {} handled, {} unsupported",
                routes.values().stream().filter(ActionRoute::isSupported).count(),
                routes.values().stream().filter(route -> !route.isSupported()).count());
    }

    /**
     * Run the handler for an inbound call and return the confirmation payload.
     *
     * @throws OcppProtocolException for unknown or unsupported actions and invalid payloads
     */
    public JsonNode dispatch(ChargePointSession session, OcppCall call) {
        OcppAction action = OcppAction.fromActionName(call.getAction())
                .filter(OcppAction::isInbound)
                .orElseThrow(() -> new OcppProtocolException(OcppErrorCode.NOT_IMPLEMENTED, call.getUniqueId(),
                        "Unknown action: " + call.getAction()));

        ActionRoute<?> route = routes.get(action);
        if (route == null || !route.isSupported()) {
            throw new OcppProtocolException(OcppErrorCode.NOT_SUPPORTED, call.getUniqueId(),
                    "Action not supported: " + action.getActionName());
        }

        log.info("Received {} from {} (uniqueId={})", action.getActionName(), session.getIdentity(), call.getUniqueId());
        Object response = invoke(route, session, call);
        return objectMapper.valueToTree(response);
    }

    private <Q> Object invoke(ActionRoute<Q> route, ChargePointSession session, OcppCall call) {
        Q request = bind(route.getRequestType(), call);

        try {
            return route.getHandler().apply(session, request);
        } catch (RuntimeException e) {
            log.error("{} handler failed for {}, answering with fallback", call.getAction(), session.getIdentity(), e);
        }

        try {
            return route.getFallback().get();
        } catch (RuntimeException e) {
            throw new OcppProtocolException(OcppErrorCode.INTERNAL_ERROR, call.getUniqueId(),
                    "Failed to process " + call.getAction(), e);
        }
    }

    private <Q> Q bind(Class<Q> requestType, OcppCall call) {
        Q request;
        try {
            request = objectMapper.treeToValue(call.getPayload(), requestType);
        } catch (InvalidFormatException e) {
            throw new OcppProtocolException(OcppErrorCode.TYPE_CONSTRAINT_VIOLATION, call.getUniqueId(),
                    "Invalid value in " + call.getAction() + ": " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new OcppProtocolException(OcppErrorCode.FORMATION_VIOLATION, call.getUniqueId(),
                    "Malformed " + call.getAction() + " payload", e);
        }

        Set<ConstraintViolation<Q>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new OcppProtocolException(errorCodeFor(violations), call.getUniqueId(),
                    "Invalid " + call.getAction() + " payload: " + detail);
        }
        return request;
    }

    // A missing required field outranks a field with a bad value
    static OcppErrorCode errorCodeFor(Set<? extends ConstraintViolation<?>> violations) {
        boolean missing = violations.stream()
                .map(v -> v.getConstraintDescriptor().getAnnotation().annotationType())
                .anyMatch(REQUIRED_CONSTRAINTS::contains);
        return missing ? OcppErrorCode.OCCURRENCE_CONSTRAINT_VIOLATION : OcppErrorCode.PROPERTY_CONSTRAINT_VIOLATION;
    }

    static final class ActionRoute<Q> {

        private final Class<Q> requestType;
        private final BiFunction<ChargePointSession, Q, Object> handler;
        private final Supplier<Object> fallback;

        private ActionRoute(Class<Q> requestType, BiFunction<ChargePointSession, Q, Object> handler,
                            Supplier<Object> fallback) {
            this.requestType = requestType;
            this.handler = handler;
            this.fallback = fallback;
        }

        static <Q> ActionRoute<Q> of(Class<Q> requestType, BiFunction<ChargePointSession, Q, Object> handler,
                                     Supplier<Object> fallback) {
            return new ActionRoute<>(requestType, handler, fallback);
        }

        static ActionRoute<Void> unsupported() {
            return new ActionRoute<>(Void.class, null, null);
        }

        boolean isSupported() {
            return handler != null;
        }

        Class<Q> getRequestType() {
            return requestType;
        }

        BiFunction<ChargePointSession, Q, Object> getHandler() {
            return handler;
        }

        Supplier<Object> getFallback() {
            return fallback;
        }
    }
}
