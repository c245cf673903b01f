package com.wpanther.ocppcentral.ocpp;

import com.fasterxml.jackson.databind.JsonNode;
import com.wpanther.ocppcentral.dto.ConnectionStats;
import com.wpanther.ocppcentral.exception.ChargePointDisconnectedException;
import com.wpanther.ocppcentral.exception.OcppCallErrorException;
import com.wpanther.ocppcentral.exception.OcppCallTimeoutException;
import com.wpanther.ocppcentral.exception.OcppProtocolException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * OCPP 1.6 call/response state machine for one charger connection.
 *
 * <p>Inbound frames are handled one at a time. Outbound calls are tracked in a
 * pending table keyed by unique id and resolved by the matching CallResult or
 * CallError, or failed by timeout or by the connection closing.
 */
@Slf4j
public class ChargePointSession {

    public static final int CLOSE_NORMAL = 1000;
    public static final int CLOSE_GOING_AWAY = 1001;
    public static final int CLOSE_SERVER_ERROR = 1011;

    // URL identity until the handshake resolves the stored charger name
    private volatile String identity;
    private final OcppTransport transport;
    private final OcppFrameCodec codec;
    private final OcppMessageDispatcher dispatcher;
    private final ScheduledExecutorService scheduler;
    private final Duration callTimeout;
    private final Consumer<ChargePointSession> closeListener;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.HANDSHAKING);
    private final Map<String, PendingCall> pendingCalls = new ConcurrentHashMap<>();
    private final ReentrantLock inboundLock = new ReentrantLock();

    private volatile ChargePointContext context;
    private volatile Instant connectedSince;
    private volatile Instant lastHeartbeat;
    private volatile Instant lastActivity;

    public ChargePointSession(String identity,
                              OcppTransport transport,
                              OcppFrameCodec codec,
                              OcppMessageDispatcher dispatcher,
                              ScheduledExecutorService scheduler,
                              Duration callTimeout,
                              Consumer<ChargePointSession> closeListener) {
        this.identity = identity;
        this.transport = transport;
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.callTimeout = callTimeout;
        this.closeListener = closeListener;
    }

    /**
     * Leave the handshaking state. A rejected handshake closes the transport
     * with the result's close code and the session never becomes active.
     *
     * @return true when the session is now active
     */
    public boolean completeHandshake(HandshakeResult result) {
        if (state.get() != SessionState.HANDSHAKING) {
            return false;
        }
        if (!result.isAccepted()) {
            state.set(SessionState.CLOSED);
            log.warn("Rejecting charge point {}: {} ({})", identity, result.getCloseReason(), result.getCloseCode());
            transport.close(result.getCloseCode(), result.getCloseReason());
            return false;
        }
        Instant now = Instant.now();
        this.context = result.getContext();
        this.identity = context.getIdentity();
        this.connectedSince = now;
        this.lastActivity = now;
        if (!state.compareAndSet(SessionState.HANDSHAKING, SessionState.ACTIVE)) {
            return false;
        }
        log.info("Charge point {} connected (chargerId={}, transport={})",
                identity, context.getChargerId(), transport.getId());
        return true;
    }

    /**
     * Handle one inbound text frame. Frames arriving outside the active state are dropped.
     */
    public void handleText(String text) {
        if (state.get() != SessionState.ACTIVE) {
            log.debug("Dropping frame from {} in state {}", identity, state.get());
            return;
        }

        inboundLock.lock();
        try {
            lastActivity = Instant.now();

            OcppFrame frame;
            try {
                frame = codec.decode(text);
            } catch (OcppProtocolException e) {
                log.warn("Malformed frame from {}: {}", identity, e.getMessage());
                send(new OcppCallError(e.getUniqueId(), e.getErrorCode(), e.getMessage()));
                return;
            }

            if (frame instanceof OcppCall) {
                handleCall((OcppCall) frame);
            } else if (frame instanceof OcppCallResult) {
                resolve((OcppCallResult) frame);
            } else {
                reject((OcppCallError) frame);
            }
        } finally {
            inboundLock.unlock();
        }
    }

    /**
     * Send a call to the charger and complete the returned future with its
     * CallResult payload. The future fails with {@link OcppCallTimeoutException},
     * {@link OcppCallErrorException} or {@link ChargePointDisconnectedException}.
     */
    public CompletableFuture<JsonNode> call(OcppAction action, Object payload) {
        if (!action.isOutbound()) {
            throw new IllegalArgumentException(action.getActionName() + " cannot be sent to a charge point");
        }

        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        if (state.get() != SessionState.ACTIVE) {
            future.completeExceptionally(new ChargePointDisconnectedException(identity));
            return future;
        }

        String uniqueId = UUID.randomUUID().toString();
        pendingCalls.put(uniqueId, new PendingCall(uniqueId, action, future, Instant.now()));

        ScheduledFuture<?> timeout = scheduler.schedule(
                () -> expire(uniqueId), callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        future.whenComplete((result, error) -> timeout.cancel(false));

        // close() may have drained the table between the state check and the put
        if (state.get() != SessionState.ACTIVE) {
            failPending(uniqueId, new ChargePointDisconnectedException(identity));
            return future;
        }

        try {
            transport.send(codec.encode(new OcppCall(uniqueId, action.getActionName(), codec.toPayload(payload))));
            log.info("Sent {} to {} (uniqueId={})", action.getActionName(), identity, uniqueId);
        } catch (IOException e) {
            log.error("Failed to send {} to {}", action.getActionName(), identity, e);
            failPending(uniqueId, new ChargePointDisconnectedException(identity, e));
            close(CLOSE_SERVER_ERROR, "Transport error");
        }
        return future;
    }

    /**
     * Close the transport and tear the session down. Idempotent.
     */
    public void close(int code, String reason) {
        if (beginClosing()) {
            log.info("Closing connection to {}: {} ({})", identity, reason, code);
            transport.close(code, reason);
            finishClosing();
        }
    }

    /**
     * The transport closed on its own (charger disconnect or transport error). Idempotent.
     */
    public void transportClosed() {
        if (beginClosing()) {
            log.info("Connection to {} closed by transport", identity);
            finishClosing();
        }
    }

    public void markHeartbeat(Instant when) {
        this.lastHeartbeat = when;
    }

    /**
     * True when nothing has been received since {@code now - window}
     */
    public boolean isIdle(Instant now, Duration window) {
        Instant last = lastActivity;
        return last != null && last.plus(window).isBefore(now);
    }

    public ConnectionStats getStats() {
        return ConnectionStats.builder()
                .identity(identity)
                .state(state.get().name())
                .connectedSince(connectedSince)
                .lastHeartbeat(lastHeartbeat)
                .lastActivity(lastActivity)
                .pendingCallCount(pendingCalls.size())
                .build();
    }

    public String getIdentity() {
        return identity;
    }

    public ChargePointContext getContext() {
        return context;
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == SessionState.ACTIVE;
    }

    private void handleCall(OcppCall call) {
        try {
            JsonNode result = dispatcher.dispatch(this, call);
            send(new OcppCallResult(call.getUniqueId(), result));
        } catch (OcppProtocolException e) {
            log.warn("Answering {} from {} with {}: {}",
                    call.getAction(), identity, e.getErrorCode().getWireName(), e.getMessage());
            send(new OcppCallError(call.getUniqueId(), e.getErrorCode(), e.getMessage()));
        }
    }

    private void resolve(OcppCallResult result) {
        PendingCall pending = pendingCalls.remove(result.getUniqueId());
        if (pending == null) {
            log.warn("Ignoring CallResult {} from {}: no pending call", result.getUniqueId(), identity);
            return;
        }
        log.info("Received {} result from {}", pending.getAction().getActionName(), identity);
        pending.getFuture().complete(result.getPayload());
    }

    private void reject(OcppCallError error) {
        PendingCall pending = pendingCalls.remove(error.getUniqueId());
        if (pending == null) {
            log.warn("Ignoring CallError {} from {}: {} {}", error.getUniqueId(), identity,
                    error.getErrorCode(), error.getErrorDescription());
            return;
        }
        pending.getFuture().completeExceptionally(new OcppCallErrorException(identity,
                pending.getAction().getActionName(), error.getErrorCode(), error.getErrorDescription()));
    }

    private void expire(String uniqueId) {
        PendingCall pending = pendingCalls.remove(uniqueId);
        if (pending != null) {
            log.warn("{} to {} timed out (uniqueId={})", pending.getAction().getActionName(), identity, uniqueId);
            pending.getFuture().completeExceptionally(
                    new OcppCallTimeoutException(identity, pending.getAction().getActionName(), callTimeout));
        }
    }

    private void failPending(String uniqueId, Throwable cause) {
        PendingCall pending = pendingCalls.remove(uniqueId);
        if (pending != null) {
            pending.getFuture().completeExceptionally(cause);
        }
    }

    private void send(OcppFrame frame) {
        try {
            transport.send(codec.encode(frame));
        } catch (IOException e) {
            log.error("Failed to send frame {} to {}", frame.getUniqueId(), identity, e);
            close(CLOSE_SERVER_ERROR, "Transport error");
        }
    }

    private boolean beginClosing() {
        while (true) {
            SessionState current = state.get();
            if (current == SessionState.CLOSING || current == SessionState.CLOSED) {
                return false;
            }
            if (state.compareAndSet(current, SessionState.CLOSING)) {
                return true;
            }
        }
    }

    private void finishClosing() {
        List<String> ids = new ArrayList<>(pendingCalls.keySet());
        for (String uniqueId : ids) {
            failPending(uniqueId, new ChargePointDisconnectedException(identity));
        }

        // Let an in-flight inbound handler finish its writes first
        inboundLock.lock();
        try {
            state.set(SessionState.CLOSED);
        } finally {
            inboundLock.unlock();
        }

        try {
            closeListener.accept(this);
        } catch (RuntimeException e) {
            log.error("Close listener failed for {}", identity, e);
        }
    }
}
