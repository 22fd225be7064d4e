package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.AppInstallRequest;
import com.brixo.tronbyt.device.model.AppUpdateRequest;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.FieldUpdate;
import com.brixo.tronbyt.device.model.MoveDirection;
import com.brixo.tronbyt.device.model.RecurrencePattern;
import com.brixo.tronbyt.device.model.RecurrenceType;
import com.brixo.tronbyt.device.sync.SyncNotifier;
import com.brixo.tronbyt.device.sync.SyncPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.brixo.tronbyt.device.service.RotationFixture.DEVICE_ID;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DeviceAppServiceTest {

    @TempDir
    Path dataDir;

    private RotationFixture fixture;
    private SyncNotifier notifier;
    private DeviceAppService service;

    @BeforeEach
    void setUp() {
        fixture = new RotationFixture(dataDir, Instant.parse("2025-01-01T12:00:00Z"));
        notifier = mock(SyncNotifier.class);
        service = new DeviceAppService(fixture.store, fixture.webpCache, notifier);
        fixture.save(RotationFixture.device());
    }

    private App install(String name) {
        return service.install(DEVICE_ID, new AppInstallRequest(name, "apps/" + name + ".star",
                null, null, null, null, null));
    }

    private List<String> order() {
        return service.list(DEVICE_ID).stream().map(App::getIname).toList();
    }

    @Test
    void installAssignsSequentialInamesAndOrder() {
        App first = install("clock");
        App second = install("weather");

        assertEquals("100", first.getIname());
        assertEquals(0, first.getOrder());
        assertEquals("101", second.getIname());
        assertEquals(1, second.getOrder());
        assertEquals("apps/weather.star", fixture.reload().getApps().get("101").getPath());
    }

    @Test
    void installCopiesOptionalFields() {
        App app = service.install(DEVICE_ID, new AppInstallRequest("clock", "apps/clock.star",
                5, 20, false, "mi reloj", Map.of("color", "red")));

        App stored = service.get(DEVICE_ID, app.getIname());
        assertEquals(5, stored.getUinterval());
        assertEquals(20, stored.getDisplayTime());
        assertFalse(stored.isEnabled());
        assertEquals("mi reloj", stored.getNotes());
        assertEquals("red", stored.getConfig().get("color"));
    }

    @Test
    void installRequiresName() {
        assertThrows(IllegalArgumentException.class, () -> service.install(DEVICE_ID,
                new AppInstallRequest(" ", "apps/x.star", null, null, null, null, null)));
    }

    @Test
    void nextInameIgnoresNonNumericKeys() {
        Device device = RotationFixture.device();
        device.putApp(new App("promo", "pushed", 0));
        device.putApp(new App("104", "clock", 1));

        assertEquals("105", DeviceAppService.nextIname(device));
        assertEquals("100", DeviceAppService.nextIname(RotationFixture.device()));
    }

    @Test
    void deleteKeepsOrderGapsAndClearsPin() throws Exception {
        install("a");
        App b = install("b");
        install("c");
        service.pin(DEVICE_ID, b.getIname());
        Path image = fixture.webpCache.appImage(DEVICE_ID, b);
        fixture.webpCache.write(image, new byte[] {1});

        service.delete(DEVICE_ID, b.getIname());

        Device device = fixture.reload();
        assertEquals(List.of("100", "102"), order());
        assertEquals(2, device.getApps().get("102").getOrder());
        assertNull(device.getPinnedApp());
        assertFalse(Files.exists(image));
        assertEquals("103", install("d").getIname());
    }

    @Test
    void moveSwapsNeighboursAndRenumbers() {
        install("a");
        install("b");
        install("c");
        service.delete(DEVICE_ID, "100");

        service.move(DEVICE_ID, "102", MoveDirection.UP);

        assertEquals(List.of("102", "101"), order());
        Device device = fixture.reload();
        assertEquals(0, device.getApps().get("102").getOrder());
        assertEquals(1, device.getApps().get("101").getOrder());
    }

    @Test
    void moveAtEdgeIsNoOp() {
        install("a");
        install("b");

        service.move(DEVICE_ID, "100", MoveDirection.UP);
        service.move(DEVICE_ID, "101", MoveDirection.DOWN);

        assertEquals(List.of("100", "101"), order());
    }

    @Test
    void moveUnknownAppFails() {
        assertThrows(DeviceNotFoundException.class, () -> service.move(DEVICE_ID, "999", MoveDirection.DOWN));
    }

    @Test
    void updateChangesOnlyGivenFields() {
        App app = install("clock");
        AppUpdateRequest request = new AppUpdateRequest(false, null, 30, null, null, "08:00", "",
                List.of("monday"), true, RecurrenceType.MONTHLY, 2, RecurrencePattern.dayOfWeek("first_monday"),
                LocalDate.of(2025, 2, 1), null, null);

        service.update(DEVICE_ID, app.getIname(), request);

        App stored = service.get(DEVICE_ID, app.getIname());
        assertFalse(stored.isEnabled());
        assertEquals(30, stored.getDisplayTime());
        assertEquals("08:00", stored.getStartTime());
        assertNull(stored.getEndTime());
        assertEquals(List.of("monday"), stored.getDays());
        assertEquals(RecurrenceType.MONTHLY, stored.getRecurrenceType());
        assertEquals("first_monday", stored.getRecurrencePattern().dayOfWeek());
        assertEquals(LocalDate.of(2025, 2, 1), stored.getRecurrenceStartDate());
        assertEquals("apps/clock.star", stored.getPath());
    }

    @Test
    void configChangeForcesRerender() {
        App app = install("clock");
        fixture.store.update(DEVICE_ID, FieldUpdate.app("100", "lastRender", 999L));

        service.update(DEVICE_ID, app.getIname(), new AppUpdateRequest(null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, Map.of("city", "Bogotá")));

        App stored = service.get(DEVICE_ID, "100");
        assertEquals(0, stored.getLastRender());
        assertEquals("Bogotá", stored.getConfig().get("city"));
    }

    @Test
    void negativeIntervalsAreRejected() {
        install("clock");
        assertThrows(IllegalArgumentException.class, () -> service.update(DEVICE_ID, "100",
                new AppUpdateRequest(null, -1, null, null, null, null, null,
                        null, null, null, null, null, null, null, null)));
    }

    @Test
    void pinAndUnpinNotifyLiveSession() {
        install("clock");

        service.pin(DEVICE_ID, "100");
        assertEquals("100", fixture.reload().getPinnedApp());

        service.unpin(DEVICE_ID);
        assertNull(fixture.reload().getPinnedApp());

        verify(notifier, times(2)).notify(eq(DEVICE_ID), any(SyncPayload.Refresh.class));
    }

    @Test
    void pinUnknownAppFails() {
        assertThrows(DeviceNotFoundException.class, () -> service.pin(DEVICE_ID, "404"));
    }

    @Test
    void ensurePushedAppCreatesOnce() {
        install("clock");

        App pushed = service.ensurePushedApp(DEVICE_ID, "promo");
        service.ensurePushedApp(DEVICE_ID, "promo");

        assertTrue(pushed.isPushed());
        assertEquals("pushed", pushed.getName());
        assertEquals(DeviceAppService.PUSHED_APP_UINTERVAL, pushed.getUinterval());
        assertEquals(1, pushed.getOrder());
        assertEquals(2, fixture.reload().getApps().size());
    }
}
