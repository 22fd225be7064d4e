package com.brixo.tronbyt.device.ws;

import com.brixo.tronbyt.device.exception.ProtocolViolationException;
import com.brixo.tronbyt.device.model.FieldUpdate;
import com.brixo.tronbyt.device.model.ProtocolType;
import com.brixo.tronbyt.device.repository.DeviceStore;
import com.brixo.tronbyt.device.service.DeviceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.net.URI;
import java.util.concurrent.ExecutorService;

/**
 * Endpoint {@code /{deviceId}/ws}. Valida el dispositivo, registra la sesión
 * (reemplazando la anterior) y arranca su emisor; los mensajes de texto van
 * al {@link DeviceStatusReceiver}.
 */
@Component
public class DeviceWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(DeviceWebSocketHandler.class);
    static final String SESSION_ATTRIBUTE = "tronbyt.deviceSession";

    private final DeviceStore deviceStore;
    private final DeviceConnectionRegistry registry;
    private final DeviceSessionFactory sessionFactory;
    private final DeviceStatusReceiver receiver;
    private final DeviceMessageCodec codec;
    private final ExecutorService senderExecutor;

    public DeviceWebSocketHandler(DeviceStore deviceStore, DeviceConnectionRegistry registry,
            DeviceSessionFactory sessionFactory, DeviceStatusReceiver receiver, DeviceMessageCodec codec,
            ExecutorService senderExecutor) {
        this.deviceStore = deviceStore;
        this.registry = registry;
        this.sessionFactory = sessionFactory;
        this.receiver = receiver;
        this.codec = codec;
        this.senderExecutor = senderExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) throws Exception {
        String deviceId = deviceIdOf(socket.getUri());
        if (!DeviceIds.isValid(deviceId)) {
            log.warn("Conexión WebSocket rechazada, id inválido: {}", deviceId);
            socket.close(CloseStatus.POLICY_VIOLATION.withReason("Id de dispositivo inválido"));
            return;
        }
        if (deviceStore.findById(deviceId).isEmpty()) {
            log.warn("Conexión WebSocket rechazada, {} no existe", deviceId);
            socket.close(CloseStatus.POLICY_VIOLATION.withReason("Dispositivo no encontrado"));
            return;
        }
        try {
            deviceStore.update(deviceId, FieldUpdate.info("protocolType", ProtocolType.WS));
        } catch (RuntimeException e) {
            log.error("No se pudo marcar {} como WebSocket: {}", deviceId, e.getMessage());
        }

        DeviceSession session = sessionFactory.create(deviceId, socket);
        socket.getAttributes().put(SESSION_ATTRIBUTE, session);
        registry.register(session);
        session.start(senderExecutor);
        log.info("Dispositivo {} conectado por WebSocket", deviceId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        DeviceSession session = sessionOf(socket);
        if (session == null) {
            return;
        }
        try {
            receiver.receive(session, codec.decode(message.getPayload()));
        } catch (ProtocolViolationException e) {
            log.warn("Mensaje ignorado de {}: {}", session.deviceId(), e.getMessage());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession socket, BinaryMessage message) {
        log.debug("Mensaje binario ignorado ({} bytes)", message.getPayloadLength());
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        DeviceSession session = sessionOf(socket);
        log.warn("Error de transporte en {}: {}", session != null ? session.deviceId() : socket.getId(),
                exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        DeviceSession session = sessionOf(socket);
        if (session == null) {
            return;
        }
        session.cancel();
        if (registry.unregister(session)) {
            log.info("Dispositivo {} desconectado ({})", session.deviceId(), status.getCode());
        }
    }

    /** Extrae el id de rutas {@code /<id>/ws}. */
    static String deviceIdOf(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String[] segments = uri.getPath().split("/");
        for (int i = segments.length - 1; i > 0; i--) {
            if ("ws".equals(segments[i])) {
                return segments[i - 1];
            }
        }
        return null;
    }

    private static DeviceSession sessionOf(WebSocketSession socket) {
        return (DeviceSession) socket.getAttributes().get(SESSION_ATTRIBUTE);
    }
}
