package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.exception.RenderException;
import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.FieldUpdate;
import com.brixo.tronbyt.device.repository.DeviceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decide si la imagen en caché de una app sigue vigente o hay que volver a
 * renderizarla, y persiste el resultado del render.
 *
 * Trabaja sobre la instantánea del dispositivo que recibe: los cambios de
 * {@code lastRender}, {@code emptyLastRender} y {@code pinnedApp} se aplican
 * en memoria y se escriben en el store en una sola actualización.
 */
@Service
public class RenderCacheGate {

    private static final Logger log = LoggerFactory.getLogger(RenderCacheGate.class);

    private final AppRenderer renderer;
    private final WebpCache webpCache;
    private final DeviceStore deviceStore;
    private final DeviceClock deviceClock;
    private final Path dataDir;

    public RenderCacheGate(AppRenderer renderer, WebpCache webpCache, DeviceStore deviceStore,
            DeviceClock deviceClock, @Value("${tronbyt.data-dir:./data}") String dataDir) {
        this.renderer = renderer;
        this.webpCache = webpCache;
        this.deviceStore = deviceStore;
        this.deviceClock = deviceClock;
        this.dataDir = Path.of(dataDir).toAbsolutePath().normalize();
    }

    public RenderOutcome ensureRendered(Device device, App app) {
        if (app.isPushed()) {
            return RenderOutcome.PUSHED;
        }
        String appPath = app.getPath();
        if (appPath == null || appPath.isBlank()) {
            log.debug("App {} de {} no tiene ruta", app.getIname(), device.getId());
            return RenderOutcome.FAILED;
        }
        Path source = resolve(appPath);
        if (source == null) {
            log.error("Ruta de app fuera del directorio de datos: {}", appPath);
            return RenderOutcome.FAILED;
        }
        Path target = webpCache.appImage(device.getId(), app);

        if (appPath.toLowerCase(Locale.ROOT).endsWith(".webp")) {
            return ensureStaticCopy(source, target);
        }

        long now = deviceClock.epochSeconds();
        if (now - app.getLastRender() < app.getUinterval() * 60L) {
            return RenderOutcome.FRESH;
        }
        return render(device, app, source, target, now);
    }

    private RenderOutcome ensureStaticCopy(Path source, Path target) {
        if (Files.exists(target)) {
            return RenderOutcome.FRESH;
        }
        if (!Files.isRegularFile(source)) {
            log.warn("No existe la imagen estática {}", source);
            return RenderOutcome.FAILED;
        }
        try {
            webpCache.copy(source, target);
            return RenderOutcome.RENDERED;
        } catch (RuntimeException e) {
            log.error("Error copiando imagen estática {}: {}", source, e.getMessage());
            return RenderOutcome.FAILED;
        }
    }

    private RenderOutcome render(Device device, App app, Path source, Path target, long now) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (app.getConfig() != null) {
            config.putAll(app.getConfig());
        }
        config.put("$tz", deviceClock.zoneOf(device).getId());

        log.info("Renderizando {} para {}", app.basename(), device.getId());
        byte[] bytes = null;
        boolean failed = false;
        try {
            bytes = renderer.render(source, config, device.supports2x());
        } catch (RenderException e) {
            failed = true;
            log.error("Error renderizando {}: {}", app.basename(), e.getMessage());
        }

        if (bytes != null && bytes.length > 0) {
            try {
                webpCache.write(target, bytes);
            } catch (RuntimeException e) {
                log.error("No se pudo guardar el render de {}: {}", app.basename(), e.getMessage());
            }
        }

        boolean empty = bytes != null && bytes.length == 0;
        app.setEmptyLastRender(empty);
        app.setLastRender(now);

        List<FieldUpdate> updates = new ArrayList<>();
        updates.add(FieldUpdate.app(app.getIname(), "emptyLastRender", empty));
        updates.add(FieldUpdate.app(app.getIname(), "lastRender", now));
        if (app.isAutopin() && bytes != null && bytes.length > 0) {
            device.setPinnedApp(app.getIname());
            updates.add(FieldUpdate.device("pinnedApp", app.getIname()));
        }
        persist(device, updates);

        if (failed) {
            return RenderOutcome.FAILED;
        }
        return empty ? RenderOutcome.EMPTY : RenderOutcome.RENDERED;
    }

    private void persist(Device device, List<FieldUpdate> updates) {
        try {
            deviceStore.update(device.getId(), updates);
        } catch (RuntimeException e) {
            log.error("No se pudo guardar el estado de render de {}: {}", device.getId(), e.getMessage());
        }
    }

    private Path resolve(String appPath) {
        Path resolved = dataDir.resolve(appPath).normalize();
        return resolved.startsWith(dataDir) ? resolved : null;
    }
}
