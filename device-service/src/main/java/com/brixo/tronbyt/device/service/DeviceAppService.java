package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.AppInstallRequest;
import com.brixo.tronbyt.device.model.AppUpdateRequest;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.FieldUpdate;
import com.brixo.tronbyt.device.model.MoveDirection;
import com.brixo.tronbyt.device.repository.DeviceStore;
import com.brixo.tronbyt.device.sync.SyncNotifier;
import com.brixo.tronbyt.device.sync.SyncPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Instalaciones de apps en un dispositivo: alta, edición, baja, orden y
 * fijado.
 *
 * Las apps nuevas reciben el siguiente iname numérico libre (desde "100") y
 * {@code order} igual a la cantidad actual. Borrar no renumera; mover sí
 * deja los órdenes contiguos desde 0.
 */
@Service
public class DeviceAppService {

    private static final Logger log = LoggerFactory.getLogger(DeviceAppService.class);
    static final int FIRST_INAME = 100;
    static final int PUSHED_APP_UINTERVAL = 10;

    private final DeviceStore deviceStore;
    private final WebpCache webpCache;
    private final SyncNotifier syncNotifier;

    public DeviceAppService(DeviceStore deviceStore, WebpCache webpCache, SyncNotifier syncNotifier) {
        this.deviceStore = deviceStore;
        this.webpCache = webpCache;
        this.syncNotifier = syncNotifier;
    }

    public List<App> list(String deviceId) {
        List<App> apps = new ArrayList<>(load(deviceId).getApps().values());
        apps.sort(Comparator.comparingInt(App::getOrder).thenComparing(App::getIname));
        return apps;
    }

    public App get(String deviceId, String iname) {
        return requireApp(load(deviceId), iname);
    }

    public App install(String deviceId, AppInstallRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("La app necesita un nombre");
        }
        Device device = load(deviceId);
        App app = new App(nextIname(device), request.name(), device.getApps().size());
        app.setPath(request.path());
        if (request.uinterval() != null) {
            app.setUinterval(request.uinterval());
        }
        if (request.displayTime() != null) {
            app.setDisplayTime(request.displayTime());
        }
        if (request.enabled() != null) {
            app.setEnabled(request.enabled());
        }
        if (request.notes() != null) {
            app.setNotes(request.notes());
        }
        if (request.config() != null) {
            app.setConfig(request.config());
        }
        deviceStore.update(deviceId, FieldUpdate.putApp(app));
        log.info("App {} instalada en {} como {}", app.getName(), deviceId, app.getIname());
        return app;
    }

    /**
     * Crea la app "pushed" con el iname indicado si todavía no existe.
     */
    public App ensurePushedApp(String deviceId, String iname) {
        Device device = load(deviceId);
        App existing = device.getApps().get(iname);
        if (existing != null) {
            return existing;
        }
        App app = new App(iname, "pushed", device.getApps().size());
        app.setUinterval(PUSHED_APP_UINTERVAL);
        app.setPushed(true);
        deviceStore.update(deviceId, FieldUpdate.putApp(app));
        log.info("App push {} creada en {}", iname, deviceId);
        return app;
    }

    public App update(String deviceId, String iname, AppUpdateRequest request) {
        App app = requireApp(load(deviceId), iname);
        List<FieldUpdate> updates = new ArrayList<>();
        if (request.enabled() != null) {
            app.setEnabled(request.enabled());
            updates.add(FieldUpdate.app(iname, "enabled", request.enabled()));
        }
        if (request.uinterval() != null) {
            requireNonNegative(request.uinterval(), "uinterval");
            app.setUinterval(request.uinterval());
            updates.add(FieldUpdate.app(iname, "uinterval", request.uinterval()));
        }
        if (request.displayTime() != null) {
            requireNonNegative(request.displayTime(), "displayTime");
            app.setDisplayTime(request.displayTime());
            updates.add(FieldUpdate.app(iname, "displayTime", request.displayTime()));
        }
        if (request.notes() != null) {
            app.setNotes(request.notes());
            updates.add(FieldUpdate.app(iname, "notes", request.notes()));
        }
        if (request.autopin() != null) {
            app.setAutopin(request.autopin());
            updates.add(FieldUpdate.app(iname, "autopin", request.autopin()));
        }
        if (request.startTime() != null) {
            app.setStartTime(blankToNull(request.startTime()));
            updates.add(FieldUpdate.app(iname, "startTime", app.getStartTime()));
        }
        if (request.endTime() != null) {
            app.setEndTime(blankToNull(request.endTime()));
            updates.add(FieldUpdate.app(iname, "endTime", app.getEndTime()));
        }
        if (request.days() != null) {
            app.setDays(request.days());
            updates.add(FieldUpdate.app(iname, "days", request.days()));
        }
        if (request.useCustomRecurrence() != null) {
            app.setUseCustomRecurrence(request.useCustomRecurrence());
            updates.add(FieldUpdate.app(iname, "useCustomRecurrence", request.useCustomRecurrence()));
        }
        if (request.recurrenceType() != null) {
            app.setRecurrenceType(request.recurrenceType());
            updates.add(FieldUpdate.app(iname, "recurrenceType", request.recurrenceType()));
        }
        if (request.recurrenceInterval() != null) {
            app.setRecurrenceInterval(request.recurrenceInterval());
            updates.add(FieldUpdate.app(iname, "recurrenceInterval", request.recurrenceInterval()));
        }
        if (request.recurrencePattern() != null) {
            app.setRecurrencePattern(request.recurrencePattern());
            updates.add(FieldUpdate.app(iname, "recurrencePattern", request.recurrencePattern()));
        }
        if (request.recurrenceStartDate() != null) {
            app.setRecurrenceStartDate(request.recurrenceStartDate());
            updates.add(FieldUpdate.app(iname, "recurrenceStartDate", request.recurrenceStartDate()));
        }
        if (request.recurrenceEndDate() != null) {
            app.setRecurrenceEndDate(request.recurrenceEndDate());
            updates.add(FieldUpdate.app(iname, "recurrenceEndDate", request.recurrenceEndDate()));
        }
        if (request.config() != null) {
            app.setConfig(request.config());
            // La configuración cambió: el próximo ciclo vuelve a renderizar
            app.setLastRender(0);
            updates.add(FieldUpdate.app(iname, "config", request.config()));
            updates.add(FieldUpdate.app(iname, "lastRender", 0L));
        }
        if (!updates.isEmpty()) {
            deviceStore.update(deviceId, updates);
        }
        return app;
    }

    public void delete(String deviceId, String iname) {
        Device device = load(deviceId);
        App app = requireApp(device, iname);
        try {
            Files.deleteIfExists(webpCache.appImage(deviceId, app));
        } catch (IOException e) {
            log.warn("No se pudo borrar la imagen de {}: {}", app.basename(), e.getMessage());
        }
        List<FieldUpdate> updates = new ArrayList<>();
        updates.add(FieldUpdate.removeApp(iname));
        if (iname.equals(device.getPinnedApp())) {
            updates.add(FieldUpdate.device("pinnedApp", null));
        }
        deviceStore.update(deviceId, updates);
        log.info("App {} eliminada de {}", iname, deviceId);
    }

    /**
     * Intercambia la app con su vecina y renumera todas desde 0. En los
     * extremos no hace nada.
     */
    public List<App> move(String deviceId, String iname, MoveDirection direction) {
        List<App> apps = list(deviceId);
        int current = -1;
        for (int i = 0; i < apps.size(); i++) {
            if (apps.get(i).getIname().equals(iname)) {
                current = i;
                break;
            }
        }
        if (current < 0) {
            throw DeviceNotFoundException.app(deviceId, iname);
        }
        int target = direction == MoveDirection.UP ? current - 1 : current + 1;
        if (target < 0 || target >= apps.size()) {
            return apps;
        }
        apps.add(target, apps.remove(current));

        List<FieldUpdate> updates = new ArrayList<>();
        for (int i = 0; i < apps.size(); i++) {
            App app = apps.get(i);
            if (app.getOrder() != i) {
                app.setOrder(i);
                updates.add(FieldUpdate.app(app.getIname(), "order", i));
            }
        }
        if (!updates.isEmpty()) {
            deviceStore.update(deviceId, updates);
        }
        return apps;
    }

    public void pin(String deviceId, String iname) {
        requireApp(load(deviceId), iname);
        deviceStore.update(deviceId, FieldUpdate.device("pinnedApp", iname));
        syncNotifier.notify(deviceId, new SyncPayload.Refresh());
    }

    public void unpin(String deviceId) {
        load(deviceId);
        deviceStore.update(deviceId, FieldUpdate.device("pinnedApp", null));
        syncNotifier.notify(deviceId, new SyncPayload.Refresh());
    }

    static String nextIname(Device device) {
        int max = FIRST_INAME - 1;
        for (String iname : device.getApps().keySet()) {
            try {
                max = Math.max(max, Integer.parseInt(iname));
            } catch (NumberFormatException e) {
                // inames no numéricos (apps push) no cuentan
            }
        }
        return String.valueOf(max + 1);
    }

    private Device load(String deviceId) {
        DeviceIds.require(deviceId);
        return deviceStore.findById(deviceId).orElseThrow(() -> DeviceNotFoundException.device(deviceId));
    }

    private static App requireApp(Device device, String iname) {
        App app = device.getApps().get(iname);
        if (app == null) {
            throw DeviceNotFoundException.app(device.getId(), iname);
        }
        return app;
    }

    private static void requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " no puede ser negativo");
        }
    }

    private static String blankToNull(String value) {
        return value.isBlank() ? null : value;
    }
}
