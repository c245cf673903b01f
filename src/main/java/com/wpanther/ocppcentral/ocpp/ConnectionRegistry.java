package com.wpanther.ocppcentral.ocpp;

import com.wpanther.ocppcentral.dto.ConnectionStats;
import com.wpanther.ocppcentral.service.ChargePointService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live charger connections, at most one per identity. The map is authoritative for
 * routing; the stored online flag is updated best effort.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectionRegistry {

    private final ChargePointService chargePointService;

    private final ConcurrentMap<String, ChargePointSession> sessions = new ConcurrentHashMap<>();

    /**
     * Register an active session, closing any session it replaces.
     */
    public void register(String identity, ChargePointSession session) {
        ChargePointSession previous = sessions.put(identity, session);
        if (previous != null && previous != session) {
            log.info("Replacing existing connection for {}", identity);
            previous.close(ChargePointSession.CLOSE_NORMAL, "Replaced by a new connection");
        }

        ChargePointContext context = session.getContext();
        if (context != null) {
            try {
                chargePointService.markOnline(context.getChargerId());
            } catch (RuntimeException e) {
                log.error("Failed to mark charge point {} online", identity, e);
            }
        }
        log.info("Registered connection for {} ({} connected)", identity, sessions.size());
    }

    /**
     * Remove the mapping only if {@code session} is still the registered one.
     *
     * @return true when the mapping was removed
     */
    public boolean unregister(String identity, ChargePointSession session) {
        if (!sessions.remove(identity, session)) {
            log.debug("Connection for {} already replaced or removed", identity);
            return false;
        }

        ChargePointContext context = session.getContext();
        if (context != null) {
            markOffline(identity, context.getChargerId());
        }
        log.info("Unregistered connection for {} ({} connected)", identity, sessions.size());
        return true;
    }

    // A reconnect may register between the removal and the offline write; its online flag must win
    private void markOffline(String identity, Long chargerId) {
        if (sessions.containsKey(identity)) {
            log.debug("Charge point {} reconnected, keeping it online", identity);
            return;
        }
        try {
            chargePointService.markOffline(chargerId);
            if (sessions.containsKey(identity)) {
                chargePointService.markOnline(chargerId);
            }
        } catch (RuntimeException e) {
            log.error("Failed to mark charge point {} offline", identity, e);
        }
    }

    public Optional<ChargePointSession> get(String identity) {
        return Optional.ofNullable(sessions.get(identity));
    }

    public boolean isConnected(String identity) {
        return sessions.containsKey(identity);
    }

    public Set<String> listIdentities() {
        return new TreeSet<>(sessions.keySet());
    }

    public Optional<ConnectionStats> stats(String identity) {
        return get(identity).map(ChargePointSession::getStats);
    }

    /**
     * Close the connection of a charger if it is connected
     *
     * @return true when a connection was closed
     */
    public boolean forceClose(String identity, String reason) {
        Optional<ChargePointSession> session = get(identity);
        session.ifPresent(s -> s.close(ChargePointSession.CLOSE_NORMAL, reason));
        return session.isPresent();
    }

    public Collection<ChargePointSession> activeSessions() {
        return new ArrayList<>(sessions.values());
    }
}
