package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.Device;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class DisplayModesTest {

    private final DisplayModes modes = new DisplayModes(
            new DeviceClock(Clock.fixed(Instant.parse("2025-01-01T03:00:00Z"), ZoneOffset.UTC), "UTC"));

    private static ZonedDateTime at(String time) {
        return LocalDateTime.parse("2025-01-01T" + time).atZone(ZoneOffset.UTC);
    }

    private static Device nightDevice() {
        Device device = new Device("abcd1234", "tester");
        device.setBrightness(80);
        device.setNightModeEnabled(true);
        device.setNightStart("22:00");
        device.setNightEnd("06:00");
        device.setNightBrightness(10);
        return device;
    }

    @Test
    void nightWindowIsHalfOpen() {
        Device device = nightDevice();

        assertTrue(modes.isNightModeActive(device, at("22:00")));
        assertTrue(modes.isNightModeActive(device, at("05:59")));
        assertFalse(modes.isNightModeActive(device, at("06:00")));
        assertFalse(modes.isNightModeActive(device, at("21:59")));
    }

    @Test
    void nightModeNeedsFlagAndStart() {
        Device disabled = nightDevice();
        disabled.setNightModeEnabled(false);
        assertFalse(modes.isNightModeActive(disabled, at("23:00")));

        Device noStart = nightDevice();
        noStart.setNightStart(null);
        assertFalse(modes.isNightModeActive(noStart, at("23:00")));
    }

    @Test
    void nightEndDefaultsToSixAm() {
        Device device = nightDevice();
        device.setNightEnd(null);

        assertTrue(modes.isNightModeActive(device, at("05:30")));
        assertFalse(modes.isNightModeActive(device, at("06:30")));
    }

    @Test
    void usesDeviceClockWhenNoTimeGiven() {
        assertTrue(modes.isNightModeActive(nightDevice()));
        assertEquals(10, modes.effectiveBrightness(nightDevice()));
    }

    @Test
    void dimModeRunsUntilNightEnd() {
        Device device = nightDevice();
        device.setNightModeEnabled(false);
        device.setDimTime("20:00");
        device.setDimBrightness(40);

        assertTrue(modes.isDimModeActive(device, at("20:30")));
        assertTrue(modes.isDimModeActive(device, at("02:00")));
        assertFalse(modes.isDimModeActive(device, at("07:00")));
        assertEquals(40, modes.effectiveBrightness(device, at("21:00")));
        assertEquals(80, modes.effectiveBrightness(device, at("12:00")));
    }

    @Test
    void nightBrightnessWinsOverDim() {
        Device device = nightDevice();
        device.setDimTime("20:00");
        device.setDimBrightness(40);

        assertEquals(40, modes.effectiveBrightness(device, at("21:00")));
        assertEquals(10, modes.effectiveBrightness(device, at("23:00")));
    }

    @Test
    void dimWithoutDimBrightnessKeepsNormalBrightness() {
        Device device = nightDevice();
        device.setNightModeEnabled(false);
        device.setDimTime("20:00");

        assertEquals(80, modes.effectiveBrightness(device, at("21:00")));
    }

    @Test
    void emptyWindowNeverMatches() {
        assertFalse(DisplayModes.inHalfOpenWindow(LocalTime.of(8, 0), LocalTime.of(8, 0), LocalTime.of(8, 0)));
    }

    @Test
    void deviceTimezoneShiftsNightWindow() {
        Device device = nightDevice();
        // 03:00 UTC son las 22:00 del día anterior en Bogotá
        device.setTimezone("America/Bogota");
        device.setNightStart("21:00");
        device.setNightEnd("23:00");

        assertTrue(modes.isNightModeActive(device));
    }
}
