package com.brixo.tronbyt.device.ws;

import com.brixo.tronbyt.device.model.FieldUpdate;
import com.brixo.tronbyt.device.repository.DeviceStore;
import com.brixo.tronbyt.device.service.DeviceClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Aplica los mensajes del dispositivo: acuses de cola y de pantalla, datos
 * del firmware y {@code lastSeen} en cada mensaje.
 */
@Component
public class DeviceStatusReceiver {

    private static final Logger log = LoggerFactory.getLogger(DeviceStatusReceiver.class);

    private final DeviceStore deviceStore;
    private final DeviceClock deviceClock;

    public DeviceStatusReceiver(DeviceStore deviceStore, DeviceClock deviceClock) {
        this.deviceStore = deviceStore;
        this.deviceClock = deviceClock;
    }

    public void receive(DeviceSession session, ClientMessage message) {
        String deviceId = session.deviceId();
        List<FieldUpdate> updates = new ArrayList<>();
        updates.add(FieldUpdate.device("lastSeen", deviceClock.instant()));

        if (message instanceof ClientMessage.Queued queued) {
            log.debug("{} encoló {}", deviceId, queued.counter());
            session.ack().markQueued(queued.counter());
            stampProtocolVersion(session, updates);
        } else if (message instanceof ClientMessage.Displaying displaying) {
            log.debug("{} muestra {}", deviceId, displaying.counter());
            session.ack().markDisplaying(displaying.counter());
            stampProtocolVersion(session, updates);
        } else if (message instanceof ClientMessage.ClientInfo info) {
            log.info("{} informa firmware {} ({}), protocolo {}", deviceId,
                    info.firmwareVersion(), info.firmwareType(), info.protocolVersion());
            addIfPresent(updates, "firmwareVersion", info.firmwareVersion());
            addIfPresent(updates, "firmwareType", info.firmwareType());
            addIfPresent(updates, "protocolVersion", info.protocolVersion());
            addIfPresent(updates, "macAddress", info.macAddress());
        }

        try {
            deviceStore.update(deviceId, updates);
        } catch (RuntimeException e) {
            log.error("No se pudo guardar el estado de {}: {}", deviceId, e.getMessage());
        }
    }

    /** Primer acuse de un firmware sin versión registrada: se asume protocolo 1. */
    private void stampProtocolVersion(DeviceSession session, List<FieldUpdate> updates) {
        if (!session.claimProtocolStamp()) {
            return;
        }
        deviceStore.findById(session.deviceId())
                .filter(device -> device.getInfo().getProtocolVersion() == null)
                .ifPresent(device -> updates.add(FieldUpdate.info("protocolVersion", 1)));
    }

    private static void addIfPresent(List<FieldUpdate> updates, String field, Object value) {
        if (value != null) {
            updates.add(FieldUpdate.info(field, value));
        }
    }
}
