package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.Device;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static com.brixo.tronbyt.device.service.RotationFixture.app;
import static com.brixo.tronbyt.device.service.RotationFixture.text;
import static org.junit.jupiter.api.Assertions.*;

class RenderCacheGateTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    @TempDir
    Path dataDir;

    private RotationFixture fixture;
    private RenderCacheGate gate;
    private Device device;

    @BeforeEach
    void setUp() {
        fixture = new RotationFixture(dataDir, NOW);
        gate = fixture.renderCacheGate;
        device = RotationFixture.device();
    }

    private App install(App app) {
        device.putApp(app);
        fixture.save(device);
        return app;
    }

    @Test
    void recentRenderIsReused() {
        App app = install(app("100", "clock", 0));
        app.setUinterval(10);
        app.setLastRender(NOW.getEpochSecond() - 60);

        assertEquals(RenderOutcome.FRESH, gate.ensureRendered(device, app));
        assertTrue(fixture.renders.isEmpty());
    }

    @Test
    void renderIsStaleOnceIntervalElapses() {
        App app = install(app("100", "clock", 0));
        app.setUinterval(10);
        app.setLastRender(NOW.getEpochSecond() - 600);

        assertEquals(RenderOutcome.RENDERED, gate.ensureRendered(device, app));
        assertEquals("clock.star", text(fixture.webpCache.read(fixture.webpCache.appImage(device.getId(), app))
                .orElseThrow()));
        App stored = fixture.reload().getApps().get("100");
        assertEquals(NOW.getEpochSecond(), stored.getLastRender());
        assertFalse(stored.isEmptyLastRender());
    }

    @Test
    void emptyRenderIsRecordedWithoutWritingFile() {
        App app = install(app("100", "clock", 0));
        fixture.emptyOutputs.add("clock.star");

        assertEquals(RenderOutcome.EMPTY, gate.ensureRendered(device, app));
        assertTrue(app.isEmptyLastRender());
        assertTrue(fixture.reload().getApps().get("100").isEmptyLastRender());
        assertFalse(Files.exists(fixture.webpCache.appImage(device.getId(), app)));
        assertTrue(RenderOutcome.EMPTY.succeeded());
    }

    @Test
    void failedRenderStillAdvancesLastRender() {
        App app = install(app("100", "clock", 0));
        app.setEmptyLastRender(true);
        fixture.failingOutputs.add("clock.star");

        assertEquals(RenderOutcome.FAILED, gate.ensureRendered(device, app));
        assertFalse(RenderOutcome.FAILED.succeeded());
        App stored = fixture.reload().getApps().get("100");
        assertEquals(NOW.getEpochSecond(), stored.getLastRender());
        assertFalse(stored.isEmptyLastRender());
    }

    @Test
    void autopinPinsAppWithOutput() {
        App app = app("100", "alert", 0);
        app.setAutopin(true);
        install(app);

        gate.ensureRendered(device, app);

        assertEquals("100", device.getPinnedApp());
        assertEquals("100", fixture.reload().getPinnedApp());
    }

    @Test
    void autopinIgnoresEmptyOutput() {
        App app = app("100", "alert", 0);
        app.setAutopin(true);
        install(app);
        fixture.emptyOutputs.add("alert.star");

        gate.ensureRendered(device, app);

        assertNull(fixture.reload().getPinnedApp());
    }

    @Test
    void configCarriesDeviceTimezone() {
        device.setTimezone("America/Bogota");
        App app = app("100", "clock", 0);
        app.setConfig(Map.of("color", "red"));
        install(app);

        gate.ensureRendered(device, app);

        Map<String, Object> config = fixture.configs.get("clock.star");
        assertEquals("America/Bogota", config.get("$tz"));
        assertEquals("red", config.get("color"));
        assertFalse(app.getConfig().containsKey("$tz"));
    }

    @Test
    void staticWebpIsCopiedOnce() throws Exception {
        Files.createDirectories(dataDir.resolve("apps"));
        Files.writeString(dataDir.resolve("apps/logo.webp"), "logo");
        App app = new App("100", "logo", 0);
        app.setPath("apps/logo.webp");
        install(app);

        assertEquals(RenderOutcome.RENDERED, gate.ensureRendered(device, app));
        assertEquals(RenderOutcome.FRESH, gate.ensureRendered(device, app));
        assertTrue(fixture.renders.isEmpty());
        assertEquals("logo", Files.readString(fixture.webpCache.appImage(device.getId(), app)));
    }

    @Test
    void missingStaticWebpFails() {
        App app = new App("100", "logo", 0);
        app.setPath("apps/missing.webp");
        install(app);

        assertEquals(RenderOutcome.FAILED, gate.ensureRendered(device, app));
    }

    @Test
    void pushedAppIsNeverRendered() {
        App app = new App("100", "pushed", 0);
        app.setPushed(true);
        install(app);

        assertEquals(RenderOutcome.PUSHED, gate.ensureRendered(device, app));
        assertTrue(fixture.renders.isEmpty());
    }

    @Test
    void pathsOutsideDataDirAreRejected() {
        App app = new App("100", "evil", 0);
        app.setPath("../../etc/evil.star");
        install(app);

        assertEquals(RenderOutcome.FAILED, gate.ensureRendered(device, app));
        assertTrue(fixture.renders.isEmpty());
    }

    @Test
    void appWithoutPathFails() {
        App app = install(new App("100", "nopath", 0));

        assertEquals(RenderOutcome.FAILED, gate.ensureRendered(device, app));
    }
}
