package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.DeviceCreateRequest;
import com.brixo.tronbyt.device.model.DeviceSettingsRequest;
import com.brixo.tronbyt.device.model.FieldUpdate;
import com.brixo.tronbyt.device.repository.DeviceStore;
import com.brixo.tronbyt.device.sync.SyncNotifier;
import com.brixo.tronbyt.device.sync.SyncPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Alta, baja y configuración de pantalla de los dispositivos. Los cambios
 * se avisan a la sesión activa para que los aplique sin esperar al
 * siguiente frame.
 */
@Service
public class DeviceSettingsService {

    private static final Logger log = LoggerFactory.getLogger(DeviceSettingsService.class);

    private final DeviceStore deviceStore;
    private final WebpCache webpCache;
    private final SyncNotifier syncNotifier;
    private final DisplayModes displayModes;
    private final SecureRandom random = new SecureRandom();

    public DeviceSettingsService(DeviceStore deviceStore, WebpCache webpCache, SyncNotifier syncNotifier,
            DisplayModes displayModes) {
        this.deviceStore = deviceStore;
        this.webpCache = webpCache;
        this.syncNotifier = syncNotifier;
        this.displayModes = displayModes;
    }

    public List<Device> findAll() {
        return deviceStore.findAll();
    }

    public Device get(String deviceId) {
        DeviceIds.require(deviceId);
        return deviceStore.findById(deviceId).orElseThrow(() -> DeviceNotFoundException.device(deviceId));
    }

    public Device create(DeviceCreateRequest request) {
        String id = request.id() != null ? DeviceIds.require(request.id()) : newDeviceId();
        if (deviceStore.findById(id).isPresent()) {
            throw new IllegalArgumentException("Ya existe un dispositivo con id " + id);
        }
        Device device = new Device(id, request.owner());
        if (request.name() != null) {
            device.setName(request.name());
        }
        if (request.type() != null) {
            device.setType(request.type());
        }
        if (request.timezone() != null) {
            device.setTimezone(requireZone(request.timezone()));
        }
        deviceStore.save(device);
        log.info("Dispositivo {} creado", id);
        return device;
    }

    /** Borra el dispositivo y su directorio de imágenes. */
    public void delete(String deviceId) {
        DeviceIds.require(deviceId);
        if (!deviceStore.delete(deviceId)) {
            throw DeviceNotFoundException.device(deviceId);
        }
        webpCache.purge(deviceId);
        syncNotifier.notify(deviceId, new SyncPayload.Refresh());
        log.info("Dispositivo {} eliminado", deviceId);
    }

    public Device updateSettings(String deviceId, DeviceSettingsRequest request) {
        Device device = get(deviceId);
        List<FieldUpdate> updates = new ArrayList<>();
        if (request.name() != null) {
            device.setName(request.name());
            updates.add(FieldUpdate.device("name", request.name()));
        }
        if (request.type() != null) {
            device.setType(request.type());
            updates.add(FieldUpdate.device("type", request.type()));
        }
        if (request.brightness() != null) {
            device.setBrightness(requirePercent(request.brightness(), "brightness"));
            updates.add(FieldUpdate.device("brightness", request.brightness()));
        }
        if (request.nightModeEnabled() != null) {
            device.setNightModeEnabled(request.nightModeEnabled());
            updates.add(FieldUpdate.device("nightModeEnabled", request.nightModeEnabled()));
        }
        if (request.nightModeApp() != null) {
            device.setNightModeApp(request.nightModeApp());
            updates.add(FieldUpdate.device("nightModeApp", request.nightModeApp()));
        }
        if (request.nightStart() != null) {
            device.setNightStart(requireTime(request.nightStart(), "nightStart"));
            updates.add(FieldUpdate.device("nightStart", device.getNightStart()));
        }
        if (request.nightEnd() != null) {
            device.setNightEnd(requireTime(request.nightEnd(), "nightEnd"));
            updates.add(FieldUpdate.device("nightEnd", device.getNightEnd()));
        }
        if (request.nightBrightness() != null) {
            device.setNightBrightness(requirePercent(request.nightBrightness(), "nightBrightness"));
            updates.add(FieldUpdate.device("nightBrightness", request.nightBrightness()));
        }
        if (request.dimTime() != null) {
            device.setDimTime(requireTime(request.dimTime(), "dimTime"));
            updates.add(FieldUpdate.device("dimTime", device.getDimTime()));
        }
        if (request.dimBrightness() != null) {
            device.setDimBrightness(requirePercent(request.dimBrightness(), "dimBrightness"));
            updates.add(FieldUpdate.device("dimBrightness", request.dimBrightness()));
        }
        if (request.defaultInterval() != null) {
            if (request.defaultInterval() < 1) {
                throw new IllegalArgumentException("defaultInterval debe ser al menos 1");
            }
            device.setDefaultInterval(request.defaultInterval());
            updates.add(FieldUpdate.device("defaultInterval", request.defaultInterval()));
        }
        if (request.timezone() != null) {
            device.setTimezone(requireZone(request.timezone()));
            updates.add(FieldUpdate.device("timezone", device.getTimezone()));
        }
        if (request.interstitialEnabled() != null) {
            device.setInterstitialEnabled(request.interstitialEnabled());
            updates.add(FieldUpdate.device("interstitialEnabled", request.interstitialEnabled()));
        }
        if (request.interstitialApp() != null) {
            device.setInterstitialApp(request.interstitialApp().isBlank() ? null : request.interstitialApp());
            updates.add(FieldUpdate.device("interstitialApp", device.getInterstitialApp()));
        }
        if (updates.isEmpty()) {
            return device;
        }
        deviceStore.update(deviceId, updates);

        if (request.brightness() != null) {
            syncNotifier.notify(deviceId, new SyncPayload.Brightness(displayModes.effectiveBrightness(device)));
        } else {
            syncNotifier.notify(deviceId, new SyncPayload.Refresh());
        }
        return device;
    }

    String newDeviceId() {
        byte[] bytes = new byte[4];
        String id;
        do {
            random.nextBytes(bytes);
            id = HexFormat.of().formatHex(bytes);
        } while (deviceStore.findById(id).isPresent());
        return id;
    }

    private static int requirePercent(int value, String field) {
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException(field + " debe estar entre 0 y 100");
        }
        return value;
    }

    private static String requireTime(String value, String field) {
        if (value.isBlank()) {
            return null;
        }
        if (ScheduleEvaluator.parseTime(value, null) == null) {
            throw new IllegalArgumentException(field + " debe tener formato HH:MM");
        }
        return value.trim();
    }

    private static String requireZone(String timezone) {
        try {
            return ZoneId.of(timezone).getId();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Zona horaria desconocida: " + timezone);
        }
    }
}
