package com.brixo.tronbyt.device.ws;

import com.brixo.tronbyt.device.repository.DeviceStore;
import com.brixo.tronbyt.device.service.DisplayModes;
import com.brixo.tronbyt.device.service.FrameFactory;
import com.brixo.tronbyt.device.service.RotationService;
import com.brixo.tronbyt.device.service.WebpCache;
import com.brixo.tronbyt.device.sync.SyncNotifier;
import com.brixo.tronbyt.device.sync.Waiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;

/**
 * Arma una {@link DeviceSession} con su waiter, su estado de acuses y su
 * emisor.
 */
@Component
public class DeviceSessionFactory {

    private final SyncNotifier syncNotifier;
    private final FrameSender.Collaborators collaborators;

    @Value("${tronbyt.ws.min-ack-timeout-seconds:25}")
    private long minAckTimeoutSeconds;

    @Value("${tronbyt.ws.poll-interval-ms:1000}")
    private long pollIntervalMs;

    public DeviceSessionFactory(SyncNotifier syncNotifier, RotationService rotationService, DeviceStore deviceStore,
            DisplayModes displayModes, WebpCache webpCache, FrameFactory frameFactory, DeviceMessageCodec codec) {
        this.syncNotifier = syncNotifier;
        this.collaborators = new FrameSender.Collaborators(rotationService, deviceStore, displayModes,
                webpCache, frameFactory, codec);
    }

    public DeviceSession create(String deviceId, WebSocketSession socket) {
        Waiter waiter = syncNotifier.getWaiter(deviceId);
        DeviceAcknowledgment ack = new DeviceAcknowledgment(waiter::wakeUp);
        FrameSender sender = new FrameSender(deviceId, socket, waiter, ack, collaborators,
                Duration.ofSeconds(minAckTimeoutSeconds), Duration.ofMillis(pollIntervalMs));
        return new DeviceSession(deviceId, socket, waiter, ack, sender);
    }
}
