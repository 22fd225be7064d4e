package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Hora local de cada dispositivo según su zona horaria configurada.
 * Si la zona falta o es inválida se usa la zona por defecto del servicio.
 */
@Component
public class DeviceClock {

    private static final Logger log = LoggerFactory.getLogger(DeviceClock.class);

    private final Clock clock;
    private final ZoneId defaultZone;

    public DeviceClock(Clock clock, @Value("${tronbyt.default-timezone:UTC}") String defaultZone) {
        this.clock = clock;
        this.defaultZone = ZoneId.of(defaultZone);
    }

    public Instant instant() {
        return clock.instant();
    }

    public long epochSeconds() {
        return clock.instant().getEpochSecond();
    }

    public ZonedDateTime now(Device device) {
        return ZonedDateTime.ofInstant(clock.instant(), zoneOf(device));
    }

    public ZoneId zoneOf(Device device) {
        String tz = device.getTimezone();
        if (tz == null || tz.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(tz);
        } catch (DateTimeException e) {
            log.warn("Zona horaria inválida '{}' en {}, usando {}", tz, device.getId(), defaultZone);
            return defaultZone;
        }
    }
}
