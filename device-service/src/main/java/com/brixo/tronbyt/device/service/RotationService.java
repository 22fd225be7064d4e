package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.FieldUpdate;
import com.brixo.tronbyt.device.model.Frame;
import com.brixo.tronbyt.device.repository.DeviceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Produce el siguiente frame de un dispositivo: imagen push pendiente, app
 * nocturna, app fijada o el siguiente elemento visible de la rotación.
 *
 * Las apps que no pasan la visibilidad o fallan al renderizar se saltan en un
 * bucle acotado por el largo de la rotación; si ninguna sirve se entrega la
 * imagen por defecto.
 */
@Service
public class RotationService {

    private static final Logger log = LoggerFactory.getLogger(RotationService.class);

    private final DeviceStore deviceStore;
    private final AppScheduler appScheduler;
    private final RenderCacheGate renderCacheGate;
    private final DisplayModes displayModes;
    private final WebpCache webpCache;
    private final FrameFactory frameFactory;
    private final DeviceClock deviceClock;

    public RotationService(DeviceStore deviceStore, AppScheduler appScheduler, RenderCacheGate renderCacheGate,
            DisplayModes displayModes, WebpCache webpCache, FrameFactory frameFactory, DeviceClock deviceClock) {
        this.deviceStore = deviceStore;
        this.appScheduler = appScheduler;
        this.renderCacheGate = renderCacheGate;
        this.displayModes = displayModes;
        this.webpCache = webpCache;
        this.frameFactory = frameFactory;
        this.deviceClock = deviceClock;
    }

    public Frame nextFrame(String deviceId) {
        return nextFrame(load(deviceId), true);
    }

    /** Frame de la app actual, sin avanzar la rotación. */
    public Frame currentFrame(String deviceId) {
        return nextFrame(load(deviceId), false);
    }

    public int brightness(String deviceId) {
        return displayModes.effectiveBrightness(load(deviceId));
    }

    /** Imagen en caché de una app concreta, sin renderizar. */
    public Optional<byte[]> appImage(String deviceId, String iname) {
        Device device = load(deviceId);
        App app = device.getApps().get(iname);
        if (app == null) {
            throw DeviceNotFoundException.app(deviceId, iname);
        }
        return webpCache.read(webpCache.appImage(deviceId, app));
    }

    /**
     * @param advance true para "next" (mueve el cursor y consume imágenes
     *                push efímeras), false para consultar la app actual
     */
    public Frame nextFrame(Device device, boolean advance) {
        ZonedDateTime now = deviceClock.now(device);
        int brightness = displayModes.effectiveBrightness(device, now);

        if (advance) {
            Optional<byte[]> pushed = webpCache.takeEphemeral(device.getId());
            if (pushed.isPresent()) {
                log.debug("Entregando imagen push efímera a {}", device.getId());
                return frameFactory.immediate(pushed.get(), brightness);
            }
        }
        if (device.getApps().isEmpty()) {
            log.debug("{} no tiene apps, imagen por defecto", device.getId());
            return frameFactory.placeholder(device, brightness);
        }
        if (brightness == 0) {
            log.debug("Brillo 0 en {}, imagen por defecto", device.getId());
            return frameFactory.placeholder(device, brightness);
        }

        Optional<Frame> override = overrideFrame(device, now, brightness);
        if (override.isPresent()) {
            return override.get();
        }
        return rotationFrame(device, advance, now, brightness);
    }

    private Optional<Frame> overrideFrame(Device device, ZonedDateTime now, int brightness) {
        Optional<App> night = appScheduler.nightModeApp(device, now);
        if (night.isPresent()) {
            Optional<byte[]> image = renderable(device, night.get());
            if (image.isPresent()) {
                return Optional.of(frameFactory.ofApp(device, night.get(), image.get(), brightness));
            }
            log.warn("La app nocturna {} de {} no se pudo renderizar, sigue la rotación",
                    night.get().getIname(), device.getId());
        }

        String pinnedIname = device.getPinnedApp();
        if (pinnedIname == null || pinnedIname.isEmpty()) {
            return Optional.empty();
        }
        Optional<App> pinned = appScheduler.pinnedApp(device);
        if (pinned.isEmpty()) {
            log.warn("La app fijada {} ya no existe en {}, se libera", pinnedIname, device.getId());
            unpin(device);
            return Optional.empty();
        }
        Optional<byte[]> image = renderable(device, pinned.get());
        if (image.isPresent()) {
            return Optional.of(frameFactory.ofApp(device, pinned.get(), image.get(), brightness));
        }
        log.warn("La app fijada {} de {} falló o quedó vacía, se libera", pinnedIname, device.getId());
        unpin(device);
        return Optional.empty();
    }

    private Frame rotationFrame(Device device, boolean advance, ZonedDateTime now, int brightness) {
        List<App> expanded = appScheduler.expandedRotation(device);
        int size = expanded.size();
        int index = appScheduler.startIndex(size, device.getLastAppIndex(), advance);

        for (int depth = 0; depth <= size; depth++) {
            AppSelection candidate = appScheduler.rotationCandidate(device, expanded, index, now);
            if (candidate.eligible()) {
                Optional<byte[]> image = renderable(device, candidate.app());
                if (image.isPresent()) {
                    if (advance) {
                        saveCursor(device, index);
                    }
                    return frameFactory.ofApp(device, candidate.app(), image.get(), brightness);
                }
            }
            index = (index + 1) % size;
        }
        log.debug("Ninguna app visible en {}, imagen por defecto", device.getId());
        return frameFactory.placeholder(device, brightness);
    }

    private Optional<byte[]> renderable(Device device, App app) {
        RenderOutcome outcome = renderCacheGate.ensureRendered(device, app);
        if (!outcome.succeeded() || app.isEmptyLastRender()) {
            return Optional.empty();
        }
        return webpCache.read(webpCache.appImage(device.getId(), app))
                .filter(bytes -> bytes.length > 0);
    }

    private void saveCursor(Device device, int index) {
        List<FieldUpdate> updates = new ArrayList<>();
        updates.add(FieldUpdate.device("lastSeen", deviceClock.instant()));
        if (index != device.getLastAppIndex()) {
            updates.add(FieldUpdate.device("lastAppIndex", index));
        }
        device.setLastAppIndex(index);
        try {
            deviceStore.update(device.getId(), updates);
        } catch (RuntimeException e) {
            log.error("No se pudo guardar el cursor de {}: {}", device.getId(), e.getMessage());
        }
    }

    private void unpin(Device device) {
        device.setPinnedApp(null);
        try {
            deviceStore.update(device.getId(), FieldUpdate.device("pinnedApp", null));
        } catch (RuntimeException e) {
            log.error("No se pudo liberar la app fijada de {}: {}", device.getId(), e.getMessage());
        }
    }

    private Device load(String deviceId) {
        return deviceStore.findById(deviceId).orElseThrow(() -> DeviceNotFoundException.device(deviceId));
    }
}
