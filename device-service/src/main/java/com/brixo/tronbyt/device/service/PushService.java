package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.repository.DeviceStore;
import com.brixo.tronbyt.device.sync.SyncNotifier;
import com.brixo.tronbyt.device.sync.SyncPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Imágenes enviadas por push.
 *
 * Sin iname la imagen se muestra una sola vez: queda como archivo efímero que
 * consume el siguiente frame, ya sea un "next" HTTP o la sesión WebSocket
 * despertada por el aviso. Con iname la imagen queda guardada como app
 * instalada y una sesión abierta la recibe por el notifier para mostrarla de
 * inmediato.
 */
@Service
public class PushService {

    private static final Logger log = LoggerFactory.getLogger(PushService.class);
    private static final Pattern INSTALLATION_ID = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    private final DeviceStore deviceStore;
    private final WebpCache webpCache;
    private final SyncNotifier syncNotifier;
    private final DeviceAppService deviceAppService;

    public PushService(DeviceStore deviceStore, WebpCache webpCache, SyncNotifier syncNotifier,
            DeviceAppService deviceAppService) {
        this.deviceStore = deviceStore;
        this.webpCache = webpCache;
        this.syncNotifier = syncNotifier;
        this.deviceAppService = deviceAppService;
    }

    public void push(String deviceId, byte[] image, String installationId) {
        DeviceIds.require(deviceId);
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("La imagen está vacía");
        }
        if (deviceStore.findById(deviceId).isEmpty()) {
            throw DeviceNotFoundException.device(deviceId);
        }

        boolean persistent = installationId != null && !installationId.isBlank();
        if (persistent && !INSTALLATION_ID.matcher(installationId).matches()) {
            throw new IllegalArgumentException("installationID inválido: " + installationId);
        }
        if (persistent) {
            webpCache.writePushedApp(deviceId, installationId, image);
            deviceAppService.ensurePushedApp(deviceId, installationId);
            log.debug("Push de {} bytes a {} como app {}", image.length, deviceId, installationId);
            syncNotifier.notify(deviceId, new SyncPayload.Image(image));
            return;
        }
        webpCache.writeEphemeral(deviceId, image);
        log.debug("Push de {} bytes a {} como imagen efímera", image.length, deviceId);
        syncNotifier.notify(deviceId, new SyncPayload.Refresh());
    }
}
