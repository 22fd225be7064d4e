package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.Device;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static com.brixo.tronbyt.device.service.RotationFixture.app;
import static org.junit.jupiter.api.Assertions.*;

class AppSchedulerTest {

    private static final ZonedDateTime NOON = LocalDateTime.parse("2025-01-01T12:00").atZone(ZoneOffset.UTC);
    private static final ZonedDateTime MIDNIGHT = LocalDateTime.parse("2025-01-01T23:30").atZone(ZoneOffset.UTC);

    private final AppScheduler scheduler = new AppScheduler(new ScheduleEvaluator(), new DisplayModes(
            new DeviceClock(Clock.fixed(Instant.parse("2025-01-01T12:00:00Z"), ZoneOffset.UTC), "UTC")));

    private static List<String> inames(List<App> apps) {
        return apps.stream().map(App::getIname).toList();
    }

    private static Device withInterstitial() {
        Device device = RotationFixture.device();
        device.putApp(app("103", "c", 2));
        device.putApp(app("101", "a", 0));
        device.putApp(app("102", "b", 1));
        device.putApp(app("900", "ad", 5));
        device.setInterstitialEnabled(true);
        device.setInterstitialApp("900");
        return device;
    }

    @Test
    void rotationIsSortedByOrder() {
        Device device = withInterstitial();
        device.setInterstitialEnabled(false);

        assertEquals(List.of("101", "102", "103", "900"), inames(scheduler.expandedRotation(device)));
    }

    @Test
    void interstitialIsInsertedBetweenApps() {
        assertEquals(List.of("101", "900", "102", "900", "103", "900", "900"),
                inames(scheduler.expandedRotation(withInterstitial())));
    }

    @Test
    void missingInterstitialAppLeavesRotationUntouched() {
        Device device = withInterstitial();
        device.setInterstitialApp("404");

        assertEquals(4, scheduler.expandedRotation(device).size());
    }

    @Test
    void startIndexAdvancesAndClamps() {
        assertEquals(1, scheduler.startIndex(3, 0, true));
        assertEquals(0, scheduler.startIndex(3, 2, true));
        assertEquals(2, scheduler.startIndex(3, 2, false));
        assertEquals(0, scheduler.startIndex(3, 9, false));
        assertEquals(1, scheduler.startIndex(3, -4, true));
    }

    @Test
    void interstitialFollowsEligibilityOfPreviousApp() {
        Device device = withInterstitial();
        List<App> expanded = scheduler.expandedRotation(device);

        AppSelection shown = scheduler.rotationCandidate(device, expanded, 1, NOON);
        assertTrue(shown.interstitial());
        assertTrue(shown.eligible());

        device.getApps().get("101").setEnabled(false);
        assertFalse(scheduler.rotationCandidate(device, expanded, 1, NOON).eligible());

        device.getApps().get("102").setEmptyLastRender(true);
        assertFalse(scheduler.rotationCandidate(device, expanded, 3, NOON).eligible());

        device.getApps().get("103").setStartTime("01:00");
        device.getApps().get("103").setEndTime("02:00");
        assertFalse(scheduler.rotationCandidate(device, expanded, 5, NOON).eligible());
    }

    @Test
    void disabledInterstitialIsSkippedInItsOwnSlot() {
        Device device = withInterstitial();
        device.getApps().get("900").setEnabled(false);
        List<App> expanded = scheduler.expandedRotation(device);

        AppSelection ownSlot = scheduler.rotationCandidate(device, expanded, 6, NOON);
        assertFalse(ownSlot.interstitial());
        assertFalse(ownSlot.eligible());
        assertTrue(scheduler.rotationCandidate(device, expanded, 1, NOON).eligible());
    }

    @Test
    void selectAppPrefersNightModeThenPinned() {
        Device device = withInterstitial();
        device.setPinnedApp("102");
        device.setNightModeEnabled(true);
        device.setNightModeApp("103");
        device.setNightStart("22:00");

        AppSelection night = scheduler.selectApp(device, 0, true, MIDNIGHT).orElseThrow();
        assertTrue(night.nightModeApp());
        assertEquals("103", night.app().getIname());

        AppSelection pinned = scheduler.selectApp(device, 0, true, NOON).orElseThrow();
        assertTrue(pinned.pinned());
        assertEquals("102", pinned.app().getIname());
    }

    @Test
    void selectAppFallsBackToRotation() {
        Device device = withInterstitial();

        AppSelection next = scheduler.selectApp(device, 0, true, NOON).orElseThrow();
        assertEquals(1, next.index());
        assertEquals("900", next.app().getIname());

        AppSelection current = scheduler.selectApp(device, 2, false, NOON).orElseThrow();
        assertEquals("102", current.app().getIname());
    }

    @Test
    void selectAppIsEmptyWithoutApps() {
        assertTrue(scheduler.selectApp(RotationFixture.device(), 0, true, NOON).isEmpty());
    }
}
