package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.Device;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Modos nocturno y atenuado de un dispositivo, y el brillo efectivo que
 * resulta de ellos. Ambas ventanas son semiabiertas {@code [inicio, fin)} y
 * pueden cruzar la medianoche.
 */
@Component
public class DisplayModes {

    static final LocalTime DEFAULT_NIGHT_END = LocalTime.of(6, 0);

    private final DeviceClock deviceClock;

    public DisplayModes(DeviceClock deviceClock) {
        this.deviceClock = deviceClock;
    }

    public boolean isNightModeActive(Device device) {
        return isNightModeActive(device, deviceClock.now(device));
    }

    public boolean isNightModeActive(Device device, ZonedDateTime now) {
        if (!device.isNightModeEnabled() || isBlank(device.getNightStart())) {
            return false;
        }
        LocalTime start = ScheduleEvaluator.parseTime(device.getNightStart(), null);
        if (start == null) {
            return false;
        }
        LocalTime end = ScheduleEvaluator.parseTime(device.getNightEnd(), DEFAULT_NIGHT_END);
        return inHalfOpenWindow(now.toLocalTime(), start, end);
    }

    public boolean isDimModeActive(Device device, ZonedDateTime now) {
        if (isBlank(device.getDimTime())) {
            return false;
        }
        LocalTime start = ScheduleEvaluator.parseTime(device.getDimTime(), null);
        if (start == null) {
            return false;
        }
        LocalTime end = ScheduleEvaluator.parseTime(device.getNightEnd(), DEFAULT_NIGHT_END);
        return inHalfOpenWindow(now.toLocalTime(), start, end);
    }

    /** Prioridad: nocturno, luego atenuado, luego el brillo normal. */
    public int effectiveBrightness(Device device) {
        return effectiveBrightness(device, deviceClock.now(device));
    }

    public int effectiveBrightness(Device device, ZonedDateTime now) {
        if (isNightModeActive(device, now)) {
            return device.getNightBrightness();
        }
        if (isDimModeActive(device, now)) {
            return device.getDimBrightness() != null ? device.getDimBrightness() : device.getBrightness();
        }
        return device.getBrightness();
    }

    static boolean inHalfOpenWindow(LocalTime time, LocalTime start, LocalTime end) {
        LocalTime minute = time.truncatedTo(ChronoUnit.MINUTES);
        if (start.equals(end)) {
            return false;
        }
        if (start.isAfter(end)) {
            return !minute.isBefore(start) || minute.isBefore(end);
        }
        return !minute.isBefore(start) && minute.isBefore(end);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
