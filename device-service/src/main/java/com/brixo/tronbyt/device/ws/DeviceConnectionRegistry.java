package com.brixo.tronbyt.device.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registro de sesiones WebSocket activas: como máximo una por dispositivo.
 * Registrar una sesión nueva cancela la anterior y espera a que su emisor
 * termine antes de devolver el control.
 */
@Component
public class DeviceConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceConnectionRegistry.class);
    static final CloseStatus SUPERSEDED = CloseStatus.NORMAL.withReason("Reemplazada por una nueva conexión");

    private final Map<String, DeviceSession> sessions = new ConcurrentHashMap<>();
    private final Duration takeoverTimeout;

    public DeviceConnectionRegistry(@Value("${tronbyt.ws.takeover-timeout-seconds:10}") long takeoverTimeoutSeconds) {
        this.takeoverTimeout = Duration.ofSeconds(takeoverTimeoutSeconds);
    }

    public void register(DeviceSession session) throws InterruptedException {
        DeviceSession previous = sessions.put(session.deviceId(), session);
        if (previous == null || previous == session) {
            return;
        }
        log.info("Nueva conexión de {}, se reemplaza la sesión anterior", session.deviceId());
        previous.cancel();
        if (!previous.awaitTermination(takeoverTimeout)) {
            log.warn("La sesión anterior de {} no terminó en {}s", session.deviceId(), takeoverTimeout.toSeconds());
        }
        previous.close(SUPERSEDED);
    }

    /**
     * Quita la sesión solo si sigue siendo la registrada, así una sesión vieja
     * no desaloja a la que la reemplazó.
     */
    public boolean unregister(DeviceSession session) {
        return sessions.remove(session.deviceId(), session);
    }

    public Optional<DeviceSession> find(String deviceId) {
        return Optional.ofNullable(sessions.get(deviceId));
    }

    public boolean isConnected(String deviceId) {
        return sessions.containsKey(deviceId);
    }

    public int size() {
        return sessions.size();
    }
}
